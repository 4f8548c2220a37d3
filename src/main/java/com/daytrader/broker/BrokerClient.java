package com.daytrader.broker;

import com.daytrader.domain.model.Fill;
import com.daytrader.domain.model.OrderStatusReport;
import com.daytrader.domain.model.Position;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Opaque request/response client for the brokerage. The engine never talks to a broker API
 * through anything else.
 *
 * <p>Every method may throw {@link com.daytrader.exception.TransientApiFailureException} for
 * failures worth repeating, and {@link com.daytrader.exception.PermanentRejectionException}
 * for refusals that must not be retried. Implementations are stateless from the engine's
 * perspective; {@link RetryingBrokerClient} adds retry and backoff on top of any of them.
 */
public interface BrokerClient {

    // ---- Market data ----

    /**
     * Returns the last traded price of a symbol.
     *
     * @throws com.daytrader.exception.PermanentRejectionException for unknown symbols
     */
    BigDecimal getQuote(String symbol);

    // ---- Account ----

    /**
     * Returns all positions currently held in the account. Owning strategy ids are unknown
     * to the broker and left null.
     */
    List<Position> getPositions();

    /** Returns the orderable cash balance of the account. */
    BigDecimal getAccountCash();

    // ---- Orders ----

    /**
     * Places a new order.
     *
     * @param orderRequest the order parameters, including the client order id
     * @return the broker-assigned order id
     */
    String placeOrder(OrderRequest orderRequest);

    /**
     * Returns the current status of an order together with all of its fills so far.
     *
     * @throws com.daytrader.exception.PermanentRejectionException if the order id is unknown
     */
    OrderStatusReport getOrderStatus(String orderId);

    /**
     * Returns every fill in the account recorded at or after {@code since}.
     */
    List<Fill> getFills(LocalDateTime since);

    /**
     * Looks up an order by the client order id supplied at submission.
     *
     * @return the broker order id, or empty if no such order exists
     */
    Optional<String> findOrderByClientOrderId(String clientOrderId);

    /**
     * Cancels the unfilled remainder of an open order.
     */
    void cancelOrder(String orderId);
}
