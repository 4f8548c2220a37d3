package com.daytrader.risk;

import com.daytrader.domain.enums.AlertSeverity;
import com.daytrader.event.FillEvent;
import com.daytrader.notification.NotificationService;
import java.math.BigDecimal;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Tracks realized PnL of the current trading day from fill events and blocks new entries once the
 * configured daily loss limit is reached. Exits are never blocked.
 */
@Component
public class DailyLossGuard {

    private static final Logger log = LoggerFactory.getLogger(DailyLossGuard.class);

    private final RiskProperties riskProperties;
    private final NotificationService notificationService;

    private LocalDate tradingDate;
    private BigDecimal realizedPnl = BigDecimal.ZERO;
    private boolean limitAlerted;

    public DailyLossGuard(RiskProperties riskProperties, NotificationService notificationService) {
        this.riskProperties = riskProperties;
        this.notificationService = notificationService;
    }

    @EventListener
    public void onFill(FillEvent event) {
        if (event.getRealizedPnl() == null || event.getRealizedPnl().signum() == 0) {
            return;
        }
        recordRealizedPnl(event.getFill().timestamp().toLocalDate(), event.getRealizedPnl());
    }

    public synchronized void recordRealizedPnl(LocalDate date, BigDecimal pnl) {
        rollIfNewDay(date);
        realizedPnl = realizedPnl.add(pnl);
        log.info("Realized PnL for {}: {} (total {})", date, pnl, realizedPnl);

        if (!limitAlerted && isLimitBreached(date)) {
            limitAlerted = true;
            notificationService.notify(
                    AlertSeverity.CRITICAL,
                    "Daily Loss Limit Reached",
                    String.format(
                            "Realized PnL %s reached the limit of -%s. No new entries today.",
                            realizedPnl.toPlainString(), riskProperties.getDailyLossLimit().toPlainString()));
        }
    }

    public synchronized boolean isLimitBreached(LocalDate date) {
        rollIfNewDay(date);
        BigDecimal limit = riskProperties.getDailyLossLimit();
        if (limit == null || limit.signum() <= 0) {
            return false;
        }
        return realizedPnl.compareTo(limit.negate()) <= 0;
    }

    public synchronized BigDecimal getRealizedPnl(LocalDate date) {
        rollIfNewDay(date);
        return realizedPnl;
    }

    private void rollIfNewDay(LocalDate date) {
        if (!date.equals(tradingDate)) {
            tradingDate = date;
            realizedPnl = BigDecimal.ZERO;
            limitAlerted = false;
        }
    }
}
