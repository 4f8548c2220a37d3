package com.daytrader.sizing;

import com.daytrader.domain.enums.SizingPolicy;
import com.daytrader.exception.ConfigurationException;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Resolves a {@link PositionSizer} implementation by {@link SizingPolicy}.
 *
 * <p>Spring discovers all PositionSizer beans and this factory indexes them by type at
 * construction time.
 */
@Component
public class PositionSizerFactory {

    private final Map<SizingPolicy, PositionSizer> sizersByType;
    private final PositionSizingConfig positionSizingConfig;

    public PositionSizerFactory(List<PositionSizer> positionSizers, PositionSizingConfig positionSizingConfig) {
        this.sizersByType =
                positionSizers.stream().collect(Collectors.toMap(PositionSizer::getType, Function.identity()));
        this.positionSizingConfig = positionSizingConfig;
        getSizer(positionSizingConfig.getPolicy());
    }

    /** The sizer for the configured policy. */
    public PositionSizer getActiveSizer() {
        return getSizer(positionSizingConfig.getPolicy());
    }

    /**
     * @throws ConfigurationException if no sizer is registered for the policy
     */
    public PositionSizer getSizer(SizingPolicy sizingPolicy) {
        PositionSizer positionSizer = sizersByType.get(sizingPolicy);
        if (positionSizer == null) {
            throw new ConfigurationException("No position sizer found for policy: " + sizingPolicy);
        }
        return positionSizer;
    }
}
