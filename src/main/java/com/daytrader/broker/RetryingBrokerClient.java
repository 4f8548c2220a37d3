package com.daytrader.broker;

import com.daytrader.domain.enums.AlertSeverity;
import com.daytrader.domain.enums.CallClass;
import com.daytrader.domain.model.Fill;
import com.daytrader.domain.model.OrderStatusReport;
import com.daytrader.domain.model.Position;
import com.daytrader.exception.PermanentRejectionException;
import com.daytrader.exception.TransientApiFailureException;
import com.daytrader.notification.FailureEscalator;
import com.daytrader.notification.NotificationService;
import com.daytrader.observability.TradingMetrics;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorates a {@link BrokerClient} with bounded retry and exponential backoff.
 *
 * <p>Each call belongs to a {@link CallClass} with its own Resilience4j {@link Retry}:
 * <ul>
 *   <li>QUOTE -- {@code getQuote}</li>
 *   <li>READ -- positions, cash, order status, fills, client-id lookup, cancel</li>
 *   <li>SUBMIT -- {@code placeOrder}</li>
 * </ul>
 *
 * <p>Only {@link TransientApiFailureException} is retried. {@link PermanentRejectionException}
 * surfaces on the first occurrence. When a class exhausts its attempts the wrapper logs, counts
 * the failure, raises an alert and throws a new {@link TransientApiFailureException}.
 *
 * <p>Submission retries are idempotency-checked: before every attempt after the first, the
 * broker is asked whether an order with the request's client order id already exists. If it
 * does (the earlier attempt reached the broker but the response was lost), that order id is
 * returned and nothing is resubmitted.
 */
public class RetryingBrokerClient implements BrokerClient {

    private static final Logger log = LoggerFactory.getLogger(RetryingBrokerClient.class);

    private final BrokerClient delegate;
    private final BrokerRetryProperties brokerRetryProperties;
    private final NotificationService notificationService;
    private final TradingMetrics tradingMetrics;
    private final FailureEscalator failureEscalator;
    private final Map<CallClass, Retry> retries = new EnumMap<>(CallClass.class);

    public RetryingBrokerClient(
            BrokerClient delegate,
            BrokerRetryProperties brokerRetryProperties,
            NotificationService notificationService,
            TradingMetrics tradingMetrics,
            FailureEscalator failureEscalator) {
        this.delegate = delegate;
        this.brokerRetryProperties = brokerRetryProperties;
        this.notificationService = notificationService;
        this.tradingMetrics = tradingMetrics;
        this.failureEscalator = failureEscalator;
        for (CallClass callClass : CallClass.values()) {
            retries.put(callClass, buildRetry(callClass, brokerRetryProperties.forClass(callClass)));
        }
    }

    @Override
    public BigDecimal getQuote(String symbol) {
        return execute(CallClass.QUOTE, "getQuote " + symbol, () -> delegate.getQuote(symbol));
    }

    @Override
    public List<Position> getPositions() {
        return execute(CallClass.READ, "getPositions", delegate::getPositions);
    }

    @Override
    public BigDecimal getAccountCash() {
        return execute(CallClass.READ, "getAccountCash", delegate::getAccountCash);
    }

    @Override
    public String placeOrder(OrderRequest orderRequest) {
        AtomicInteger attempt = new AtomicInteger();
        return execute(
                CallClass.SUBMIT,
                "placeOrder " + orderRequest.getSide() + " " + orderRequest.getSymbol(),
                () -> submitOnce(orderRequest, attempt.incrementAndGet()));
    }

    @Override
    public OrderStatusReport getOrderStatus(String orderId) {
        return execute(CallClass.READ, "getOrderStatus " + orderId, () -> delegate.getOrderStatus(orderId));
    }

    @Override
    public List<Fill> getFills(LocalDateTime since) {
        return execute(CallClass.READ, "getFills", () -> delegate.getFills(since));
    }

    @Override
    public Optional<String> findOrderByClientOrderId(String clientOrderId) {
        return execute(
                CallClass.READ,
                "findOrderByClientOrderId " + clientOrderId,
                () -> delegate.findOrderByClientOrderId(clientOrderId));
    }

    @Override
    public void cancelOrder(String orderId) {
        execute(CallClass.READ, "cancelOrder " + orderId, () -> {
            delegate.cancelOrder(orderId);
            return null;
        });
    }

    private String submitOnce(OrderRequest orderRequest, int attempt) {
        if (attempt > 1 && orderRequest.getClientOrderId() != null) {
            Optional<String> existing = delegate.findOrderByClientOrderId(orderRequest.getClientOrderId());
            if (existing.isPresent()) {
                log.warn(
                        "Order already exists at broker, not resubmitting: clientOrderId={}, orderId={}",
                        orderRequest.getClientOrderId(),
                        existing.get());
                return existing.get();
            }
        }
        return delegate.placeOrder(orderRequest);
    }

    private <T> T execute(CallClass callClass, String operation, Supplier<T> call) {
        try {
            return retries.get(callClass).executeSupplier(call);
        } catch (TransientApiFailureException e) {
            int maxAttempts = brokerRetryProperties.forClass(callClass).getMaxAttempts();
            String message = String.format("%s failed after %d attempt(s): %s", operation, maxAttempts, e.getMessage());
            log.error("Broker call exhausted retries: {}", message);
            tradingMetrics.recordRetryExhausted(callClass);
            failureEscalator.recordFailure("TransientApiFailure");
            notificationService.notify(
                    callClass == CallClass.SUBMIT ? AlertSeverity.CRITICAL : AlertSeverity.WARNING,
                    "Broker Call Failed",
                    message);
            throw new TransientApiFailureException(message, e);
        }
    }

    private Retry buildRetry(CallClass callClass, BrokerRetryProperties.CallPolicy policy) {
        IntervalFunction intervalFunction = policy.getJitter() > 0
                ? IntervalFunction.ofExponentialRandomBackoff(
                        policy.getBaseDelay(), policy.getMultiplier(), policy.getJitter())
                : IntervalFunction.ofExponentialBackoff(policy.getBaseDelay(), policy.getMultiplier());

        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(Math.max(1, policy.getMaxAttempts()))
                .intervalFunction(intervalFunction)
                .retryExceptions(TransientApiFailureException.class)
                .ignoreExceptions(PermanentRejectionException.class)
                .build();

        Retry retry = Retry.of("broker-" + callClass.name().toLowerCase(), retryConfig);
        retry.getEventPublisher().onRetry(event -> {
            log.warn(
                    "Broker {} call failed (attempt {}), retrying in {}ms: {}",
                    callClass,
                    event.getNumberOfRetryAttempts(),
                    event.getWaitInterval().toMillis(),
                    event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown");
            tradingMetrics.recordRetry(callClass);
        });
        return retry;
    }
}
