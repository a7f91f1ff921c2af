package com.datasync.personconsumer.config;

import com.datasync.personconsumer.broker.BackoffPolicy;
import com.datasync.personconsumer.broker.BrokerConnectionManager;
import com.datasync.personconsumer.broker.BrokerUrl;
import com.datasync.personconsumer.broker.Sleeper;

import lombok.extern.slf4j.Slf4j;
import org.apache.activemq.artemis.jms.client.ActiveMQConnectionFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Apache Artemis Configuration
 *
 * Builds the connection factory from consumer.broker-url (credentials may be
 * embedded in the URL) and the connection manager driving the initial
 * connect retries. Once connected, the Artemis client itself handles
 * reconnection using the consumer.artemis.* parameters.
 */
@Configuration
@Slf4j
public class ArtemisConfig {

    @Bean
    public BrokerUrl brokerUrl(ConsumerProperties props) {
        return BrokerUrl.parse(props.getBrokerUrl());
    }

    /**
     * Replaces the Spring Boot auto-configured factory.
     */
    @Bean
    public ActiveMQConnectionFactory connectionFactory(BrokerUrl brokerUrl, ConsumerProperties props) {
        ConsumerProperties.ArtemisProps a = props.getArtemis();

        ActiveMQConnectionFactory factory = new ActiveMQConnectionFactory(brokerUrl.getAddress());
        if (brokerUrl.hasCredentials()) {
            factory.setUser(brokerUrl.getUser());
            factory.setPassword(brokerUrl.getPassword());
        }

        // initial connect is retried by BrokerConnectionManager, not by the client
        factory.setInitialConnectAttempts(1);

        factory.setRetryInterval(a.getRetryInterval());
        factory.setRetryIntervalMultiplier(a.getRetryIntervalMultiplier());
        factory.setMaxRetryInterval(a.getMaxRetryInterval());
        factory.setReconnectAttempts(a.getReconnectAttempts());
        factory.setClientFailureCheckPeriod(a.getClientFailureCheckPeriod());
        factory.setConnectionTTL(a.getConnectionTtl());

        log.info("ActiveMQ ConnectionFactory created: brokerUrl={}, retryInterval={}ms, multiplier={}, maxInterval={}ms, attempts={}",
                brokerUrl.redacted(), a.getRetryInterval(), a.getRetryIntervalMultiplier(),
                a.getMaxRetryInterval(), a.getReconnectAttempts() == -1 ? "infinite" : a.getReconnectAttempts());

        return factory;
    }

    @Bean
    public BackoffPolicy connectBackoffPolicy(ConsumerProperties props) {
        ConsumerProperties.ConnectProps c = props.getConnect();
        return new BackoffPolicy(c.getMaxAttempts(), c.getInitialDelayMs(), c.getMaxDelayMs());
    }

    @Bean
    public BrokerConnectionManager brokerConnectionManager(ActiveMQConnectionFactory connectionFactory,
                                                           BrokerUrl brokerUrl,
                                                           BackoffPolicy connectBackoffPolicy,
                                                           ConsumerProperties props) {
        return new BrokerConnectionManager(connectionFactory, brokerUrl, connectBackoffPolicy,
                Sleeper.THREAD, props.getDeadLetterQueue());
    }
}
