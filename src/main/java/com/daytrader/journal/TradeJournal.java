package com.daytrader.journal;

import com.daytrader.domain.enums.OrderSide;
import com.daytrader.domain.model.Fill;
import com.daytrader.domain.model.Order;
import com.daytrader.event.FillEvent;
import com.daytrader.event.OrderEvent;
import com.daytrader.event.OrderEventType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Append-only JSON-lines journal of orders and fills, one file per trading day:
 * {@code {directory}/trades_YYYY-MM-DD.jsonl}.
 *
 * <p>Written from order and fill events. A write failure is logged and does not affect trading;
 * the broker remains the source of truth.
 */
@Component
public class TradeJournal {

    private static final Logger log = LoggerFactory.getLogger(TradeJournal.class);

    private final ObjectMapper objectMapper;
    private final Path directory;

    public TradeJournal(ObjectMapper objectMapper, @Value("${daytrader.journal.directory:reports/trades}") String directory) {
        this.objectMapper = objectMapper;
        this.directory = Path.of(directory);
    }

    @EventListener
    public void onOrderEvent(OrderEvent event) {
        if (event.getEventType() != OrderEventType.PLACED) {
            return;
        }
        Order order = event.getOrder();
        append(TradeRecord.builder()
                .timestamp(order.getSubmittedAt())
                .type(TradeRecordType.NEW_ORDER)
                .strategyId(order.getStrategyId())
                .symbol(order.getSymbol())
                .side(order.getSignal().getSide())
                .quantity(order.getQuantity())
                .price(order.getSignal().getLimitPrice())
                .orderId(order.getOrderId())
                .clientOrderId(order.getClientOrderId())
                .orderType(order.getSignal().getOrderType().name())
                .reason(order.getSignal().getReason())
                .liquidation(order.getSignal().isLiquidation())
                .build());
    }

    @EventListener
    public void onFill(FillEvent event) {
        Fill fill = event.getFill();
        TradeRecord.TradeRecordBuilder builder = TradeRecord.builder()
                .timestamp(fill.timestamp())
                .type(TradeRecordType.FILL)
                .strategyId(event.getOrder().getStrategyId())
                .symbol(fill.symbol())
                .side(fill.side())
                .quantity(fill.quantity())
                .price(fill.price())
                .orderId(fill.orderId())
                .fillId(fill.fillId());

        if (fill.side() == OrderSide.SELL && event.getAverageCost() != null && event.getAverageCost().signum() > 0) {
            BigDecimal costBasis = event.getAverageCost().multiply(BigDecimal.valueOf(fill.quantity()));
            builder.pnl(event.getRealizedPnl())
                    .pnlPct(event.getRealizedPnl()
                            .multiply(BigDecimal.valueOf(100))
                            .divide(costBasis, 4, RoundingMode.HALF_UP));
        }
        append(builder.build());
    }

    public synchronized void append(TradeRecord tradeRecord) {
        LocalDate date = tradeRecord.getTimestamp() != null ? tradeRecord.getTimestamp().toLocalDate() : LocalDate.now();
        Path file = fileFor(date);
        try {
            Files.createDirectories(directory);
            String line = objectMapper.writeValueAsString(tradeRecord) + System.lineSeparator();
            Files.writeString(file, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.error("Failed to write trade journal entry to {}: {}", file, e.getMessage());
        }
    }

    /**
     * Reads all records of one day. Unreadable lines are logged and skipped.
     */
    public List<TradeRecord> read(LocalDate date) {
        Path file = fileFor(date);
        if (!Files.exists(file)) {
            return List.of();
        }
        List<TradeRecord> tradeRecords = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    tradeRecords.add(objectMapper.readValue(line, TradeRecord.class));
                } catch (JsonProcessingException e) {
                    log.warn("Skipping malformed journal line in {}: {}", file, e.getOriginalMessage());
                }
            }
        } catch (IOException e) {
            log.error("Failed to read trade journal {}: {}", file, e.getMessage());
        }
        return tradeRecords;
    }

    public Path getDirectory() {
        return directory;
    }

    public Path fileFor(LocalDate date) {
        return directory.resolve("trades_" + date + ".jsonl");
    }
}
