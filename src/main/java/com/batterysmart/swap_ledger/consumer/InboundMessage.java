package com.batterysmart.swap_ledger.consumer;

import lombok.Value;

import java.util.UUID;

/**
 * Identity of a message as far as duplicate detection is concerned.
 */
@Value(staticConstructor = "of")
public class InboundMessage {
    UUID eventId;
    String eventType;
    String consumerGroup;
    String stationCode;
}
