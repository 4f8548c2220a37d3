package com.daytrader.journal;

import com.daytrader.domain.enums.OrderSide;
import com.daytrader.event.FillEvent;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Win rate and average win/loss of closed trades over a lookback window, read from the trade
 * journal's sell fills. Cached per day and recomputed after every sell fill.
 */
@Component
public class TradePerformanceTracker {

    private static final Logger log = LoggerFactory.getLogger(TradePerformanceTracker.class);

    private final TradeJournal tradeJournal;
    private final int lookbackDays;

    private volatile LocalDate cachedFor;
    private volatile TradeStatistics cached;

    public TradePerformanceTracker(
            TradeJournal tradeJournal, @Value("${daytrader.sizing.kelly-lookback-days:30}") int lookbackDays) {
        this.tradeJournal = tradeJournal;
        this.lookbackDays = lookbackDays;
    }

    public TradeStatistics getStatistics(LocalDate today) {
        TradeStatistics statistics = cached;
        if (statistics != null && today.equals(cachedFor)) {
            return statistics;
        }
        statistics = compute(today);
        cached = statistics;
        cachedFor = today;
        return statistics;
    }

    @EventListener
    public void onFill(FillEvent event) {
        if (event.getFill().side() == OrderSide.SELL) {
            cached = null;
        }
    }

    private TradeStatistics compute(LocalDate today) {
        List<BigDecimal> returns = new ArrayList<>();
        for (LocalDate date = today.minusDays(lookbackDays); !date.isAfter(today); date = date.plusDays(1)) {
            for (TradeRecord tradeRecord : tradeJournal.read(date)) {
                if (tradeRecord.getType() == TradeRecordType.FILL && tradeRecord.getPnlPct() != null) {
                    returns.add(tradeRecord.getPnlPct());
                }
            }
        }
        if (returns.isEmpty()) {
            return TradeStatistics.empty();
        }

        int wins = 0;
        int losses = 0;
        double winSum = 0.0;
        double lossSum = 0.0;
        for (BigDecimal pct : returns) {
            double fraction = pct.doubleValue() / 100.0;
            if (fraction > 0) {
                wins++;
                winSum += fraction;
            } else if (fraction < 0) {
                losses++;
                lossSum += fraction;
            }
        }
        TradeStatistics statistics = new TradeStatistics(
                returns.size(),
                wins,
                losses,
                (double) wins / returns.size(),
                wins > 0 ? winSum / wins : 0.0,
                losses > 0 ? lossSum / losses : 0.0);
        log.debug("Trade statistics over {} days: {}", lookbackDays, statistics);
        return statistics;
    }
}
