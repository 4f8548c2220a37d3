package com.daytrader.unit.journal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.daytrader.domain.enums.AlertSeverity;
import com.daytrader.domain.enums.OrderSide;
import com.daytrader.domain.model.Position;
import com.daytrader.journal.DailyReportTask;
import com.daytrader.journal.DailyReportTask.DailyReport;
import com.daytrader.journal.TradeJournal;
import com.daytrader.journal.TradeRecord;
import com.daytrader.journal.TradeRecordType;
import com.daytrader.notification.NotificationService;
import com.daytrader.portfolio.PortfolioLedger;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for DailyReportTask.
 */
class DailyReportTaskTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 10, 14);

    @TempDir
    Path tempDir;

    private TradeJournal tradeJournal;
    private PortfolioLedger portfolioLedger;
    private NotificationService notificationService;
    private DailyReportTask dailyReportTask;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        tradeJournal = new TradeJournal(objectMapper, tempDir.toString());
        portfolioLedger = new PortfolioLedger();
        notificationService = mock(NotificationService.class);
        dailyReportTask = new DailyReportTask(tradeJournal, portfolioLedger, notificationService, objectMapper);

        portfolioLedger.initialize(
                new BigDecimal("1005000"),
                List.of(Position.builder()
                        .symbol("000660")
                        .quantity(2)
                        .averageCost(new BigDecimal("120000"))
                        .build()));

        tradeJournal.append(record(TradeRecordType.NEW_ORDER, OrderSide.BUY, null, 9));
        tradeJournal.append(record(TradeRecordType.FILL, OrderSide.BUY, null, 9));
        tradeJournal.append(record(TradeRecordType.NEW_ORDER, OrderSide.SELL, null, 10));
        tradeJournal.append(record(TradeRecordType.FILL, OrderSide.SELL, "6000", 10));
        tradeJournal.append(record(TradeRecordType.FILL, OrderSide.SELL, "-1000", 11));
    }

    private static TradeRecord record(TradeRecordType type, OrderSide side, String pnl, int hour) {
        return TradeRecord.builder()
                .timestamp(TODAY.atTime(hour, 0))
                .type(type)
                .symbol("005930")
                .side(side)
                .quantity(3)
                .pnl(pnl == null ? null : new BigDecimal(pnl))
                .build();
    }

    @Test
    @DisplayName("The report counts orders, fills and closed trades of the day")
    void buildsReport() {
        DailyReport report = dailyReportTask.buildReport(TODAY);

        assertThat(report.ordersPlaced()).isEqualTo(2);
        assertThat(report.fills()).isEqualTo(3);
        assertThat(report.wins()).isEqualTo(1);
        assertThat(report.losses()).isEqualTo(1);
        assertThat(report.realizedPnl()).isEqualByComparingTo("5000");
        assertThat(report.cash()).isEqualByComparingTo("1005000");
        assertThat(report.heldSymbols()).containsExactly("000660");
        assertThat(report.openOrders()).isZero();
    }

    @Test
    @DisplayName("Running writes the report file and sends an INFO alert")
    void runWritesAndNotifies() {
        dailyReportTask.run(TODAY);

        assertThat(tempDir.resolve("daily_2026-10-14.json")).exists().content().contains("\"realizedPnl\"");
        verify(notificationService)
                .notify(eq(AlertSeverity.INFO), eq("Daily report 2026-10-14"), contains("realized PnL 5000"));
    }

    @Test
    @DisplayName("A day without journal entries still reports the ledger")
    void emptyDay() {
        DailyReport report = dailyReportTask.buildReport(TODAY.plusDays(1));

        assertThat(report.ordersPlaced()).isZero();
        assertThat(report.realizedPnl()).isEqualByComparingTo("0");
        assertThat(report.heldSymbols()).containsExactly("000660");
    }
}
