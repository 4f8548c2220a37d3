package com.daytrader.sizing;

import com.daytrader.domain.enums.SizingPolicy;
import org.springframework.stereotype.Component;

/** Leaves the signal's quantity unchanged. */
@Component
public class PassThroughSizer implements PositionSizer {

    @Override
    public int maxQuantity(SizingContext sizingContext) {
        return sizingContext.signal().getQuantity();
    }

    @Override
    public SizingPolicy getType() {
        return SizingPolicy.NONE;
    }
}
