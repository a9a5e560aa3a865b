package com.batterysmart.swap_ledger.observability;

import org.slf4j.MDC;

import java.util.Locale;
import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys the ledger logs under.
 *
 * The id arrives on the X-Correlation-ID header (HTTP) or the record header
 * of the same name (Kafka) and is copied onto every outbox record the
 * request writes.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String DRIVER_ID_MDC_KEY = "driverId";
    public static final String SUBSCRIPTION_ID_MDC_KEY = "subscriptionId";
    public static final String STATION_CODE_HEADER = "X-Station-Code";
    public static final String STATION_CODE_MDC_KEY = "stationCode";

    private static final int MAX_ID_LENGTH = 64;

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Gets the current correlation ID, or generates a new one if not set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    /**
     * Accepts a caller-supplied id, truncated to a loggable length, and puts
     * it in the MDC; blank ids are replaced with a fresh one.
     */
    public static void setCorrelationId(String id) {
        String value;
        if (id != null && !id.isBlank()) {
            String trimmed = id.trim();
            value = trimmed.length() > MAX_ID_LENGTH ? trimmed.substring(0, MAX_ID_LENGTH) : trimmed;
        } else {
            value = generateCorrelationId();
        }
        correlationId.set(value);
        MDC.put(CORRELATION_ID_MDC_KEY, value);
    }

    /**
     * Clears the correlation id and every ledger MDC key from the current thread.
     */
    public static void clear() {
        correlationId.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(DRIVER_ID_MDC_KEY);
        MDC.remove(SUBSCRIPTION_ID_MDC_KEY);
        MDC.remove(STATION_CODE_MDC_KEY);
    }

    public static void tagStation(String stationCode) {
        if (stationCode != null && !stationCode.isBlank()) {
            MDC.put(STATION_CODE_MDC_KEY, stationCode.trim().toUpperCase(Locale.ROOT));
        }
    }

    public static void tagDriver(UUID driverId) {
        if (driverId != null) {
            MDC.put(DRIVER_ID_MDC_KEY, driverId.toString());
        }
    }

    public static void tagSubscription(UUID subscriptionId) {
        if (subscriptionId != null) {
            MDC.put(SUBSCRIPTION_ID_MDC_KEY, subscriptionId.toString());
        }
    }

    /**
     * Short id, readable in log lines.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }
}
