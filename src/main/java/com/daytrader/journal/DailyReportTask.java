package com.daytrader.journal;

import com.daytrader.core.engine.EndOfDayTask;
import com.daytrader.domain.enums.AlertSeverity;
import com.daytrader.domain.model.Position;
import com.daytrader.notification.NotificationService;
import com.daytrader.portfolio.PortfolioLedger;
import com.daytrader.portfolio.PortfolioSnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Summarises the trading day from the journal and the ledger, writes it next to the journal
 * as {@code daily_YYYY-MM-DD.json} and sends it as an INFO alert.
 */
@Component
public class DailyReportTask implements EndOfDayTask {

    private static final Logger log = LoggerFactory.getLogger(DailyReportTask.class);

    private final TradeJournal tradeJournal;
    private final PortfolioLedger portfolioLedger;
    private final NotificationService notificationService;
    private final ObjectMapper objectMapper;

    public DailyReportTask(
            TradeJournal tradeJournal,
            PortfolioLedger portfolioLedger,
            NotificationService notificationService,
            ObjectMapper objectMapper) {
        this.tradeJournal = tradeJournal;
        this.portfolioLedger = portfolioLedger;
        this.notificationService = notificationService;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return "daily-report";
    }

    @Override
    public void run(LocalDate tradingDate) {
        DailyReport report = buildReport(tradingDate);

        Path file = tradeJournal.getDirectory().resolve("daily_" + tradingDate + ".json");
        try {
            Files.createDirectories(tradeJournal.getDirectory());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), report);
            log.info("Daily report written to {}", file);
        } catch (IOException e) {
            log.error("Failed to write daily report {}: {}", file, e.getMessage());
        }

        notificationService.notify(AlertSeverity.INFO, "Daily report " + tradingDate, format(report));
    }

    public DailyReport buildReport(LocalDate tradingDate) {
        List<TradeRecord> tradeRecords = tradeJournal.read(tradingDate);
        int ordersPlaced = 0;
        int fills = 0;
        int wins = 0;
        int losses = 0;
        BigDecimal realizedPnl = BigDecimal.ZERO;

        for (TradeRecord tradeRecord : tradeRecords) {
            if (tradeRecord.getType() == TradeRecordType.NEW_ORDER) {
                ordersPlaced++;
            } else if (tradeRecord.getType() == TradeRecordType.FILL) {
                fills++;
                if (tradeRecord.getPnl() != null) {
                    realizedPnl = realizedPnl.add(tradeRecord.getPnl());
                    if (tradeRecord.getPnl().signum() > 0) {
                        wins++;
                    } else if (tradeRecord.getPnl().signum() < 0) {
                        losses++;
                    }
                }
            }
        }

        PortfolioSnapshot snapshot = portfolioLedger.snapshot();
        List<String> heldSymbols = snapshot.positions().stream()
                .map(Position::getSymbol)
                .filter(Objects::nonNull)
                .toList();
        return new DailyReport(
                tradingDate,
                ordersPlaced,
                fills,
                wins,
                losses,
                realizedPnl,
                snapshot.cash(),
                heldSymbols,
                snapshot.openOrders());
    }

    private String format(DailyReport report) {
        return String.format(
                "Orders %d, fills %d, closed trades %d won / %d lost, realized PnL %s, cash %s, holding %s, open orders %d",
                report.ordersPlaced(),
                report.fills(),
                report.wins(),
                report.losses(),
                report.realizedPnl().toPlainString(),
                report.cash().toPlainString(),
                report.heldSymbols().isEmpty() ? "nothing" : String.join(", ", report.heldSymbols()),
                report.openOrders());
    }

    public record DailyReport(
            LocalDate tradingDate,
            int ordersPlaced,
            int fills,
            int wins,
            int losses,
            BigDecimal realizedPnl,
            BigDecimal cash,
            List<String> heldSymbols,
            int openOrders) {}
}
