package com.daytrader.broker;

import com.daytrader.strategy.MarketSnapshot;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Quotes for strategies and the order manager's cash check, fetched through the retrying
 * broker client and cached for a few seconds.
 *
 * <p>The TTL is kept well below the engine tick interval, so a price never survives from one
 * tick into the next. Failed lookups are not cached.
 */
@Service
public class MarketDataService {

    private static final Logger log = LoggerFactory.getLogger(MarketDataService.class);

    private final BrokerClient brokerClient;
    private final Cache<String, BigDecimal> quoteCache;

    public MarketDataService(
            BrokerClient brokerClient, @Value("${daytrader.market-data.quote-ttl:5s}") Duration quoteTtl) {
        this.brokerClient = brokerClient;
        this.quoteCache = Caffeine.newBuilder()
                .expireAfterWrite(quoteTtl)
                .maximumSize(1_000)
                .build();
    }

    /**
     * Returns the last price of a symbol, or empty if the broker could not provide one.
     */
    public Optional<BigDecimal> getQuote(String symbol) {
        BigDecimal cached = quoteCache.getIfPresent(symbol);
        if (cached != null) {
            return Optional.of(cached);
        }
        try {
            BigDecimal price = brokerClient.getQuote(symbol);
            if (price == null || price.signum() <= 0) {
                log.warn("Broker returned no usable price for {}: {}", symbol, price);
                return Optional.empty();
            }
            quoteCache.put(symbol, price);
            return Optional.of(price);
        } catch (RuntimeException e) {
            log.warn("Quote unavailable for {}: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }

    public MarketSnapshot snapshot(List<String> symbols, LocalDateTime now) {
        Map<String, BigDecimal> prices = new LinkedHashMap<>();
        for (String symbol : symbols) {
            getQuote(symbol).ifPresent(price -> prices.put(symbol, price));
        }
        return MarketSnapshot.builder().asOf(now).prices(prices).build();
    }

    public void invalidateAll() {
        quoteCache.invalidateAll();
    }
}
