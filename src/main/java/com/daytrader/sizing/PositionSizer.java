package com.daytrader.sizing;

import com.daytrader.domain.enums.SizingPolicy;

/**
 * Caps the quantity of a buy signal.
 *
 * <p>The order manager takes {@code min(signal quantity, maxQuantity)}: a sizer can only shrink
 * an order, never grow it. Returning 0 rejects the signal with SIZE_ZERO.
 *
 * <p>Resolved by {@link PositionSizerFactory} from {@link PositionSizingConfig#getPolicy()}.
 */
public interface PositionSizer {

    /**
     * @return the largest quantity this policy allows (always >= 0)
     */
    int maxQuantity(SizingContext sizingContext);

    SizingPolicy getType();
}
