package com.daytrader.config;

import com.daytrader.broker.BrokerClient;
import com.daytrader.broker.BrokerRetryProperties;
import com.daytrader.broker.RetryingBrokerClient;
import com.daytrader.notification.FailureEscalator;
import com.daytrader.notification.NotificationService;
import com.daytrader.observability.TradingMetrics;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Wraps the raw broker client in the retrying decorator. Every component that injects a
 * {@link BrokerClient} gets the retrying one.
 */
@Configuration
public class BrokerConfig {

    @Bean
    @Primary
    public RetryingBrokerClient retryingBrokerClient(
            @Qualifier("rawBrokerClient") BrokerClient rawBrokerClient,
            BrokerRetryProperties brokerRetryProperties,
            NotificationService notificationService,
            TradingMetrics tradingMetrics,
            FailureEscalator failureEscalator) {
        return new RetryingBrokerClient(
                rawBrokerClient, brokerRetryProperties, notificationService, tradingMetrics, failureEscalator);
    }
}
