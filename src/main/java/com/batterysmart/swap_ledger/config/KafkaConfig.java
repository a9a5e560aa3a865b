package com.batterysmart.swap_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topics owned by the ledger.
 *
 * - ledger-events: swap, penalty and leave facts, keyed by aggregate id
 * - billing: issued invoices, consumed by the payment collection side
 * - station-swaps: swap reports pushed by station controllers
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    @Value("${kafka.topic.billing:billing-invoices}")
    private String billingTopic;

    @Value("${kafka.topic.station-swaps:station-swaps}")
    private String stationSwapsTopic;

    @Bean
    public NewTopic ledgerEventsTopic() {
        return TopicBuilder.name(ledgerEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic billingTopic() {
        return TopicBuilder.name(billingTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    /**
     * Station reports are keyed by driver id so that one driver's swaps
     * arrive in order on a single partition.
     */
    @Bean
    public NewTopic stationSwapsTopic() {
        return TopicBuilder.name(stationSwapsTopic)
                .partitions(6)
                .replicas(1)
                .build();
    }
}
