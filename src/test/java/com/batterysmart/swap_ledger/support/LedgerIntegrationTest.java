package com.batterysmart.swap_ledger.support;

import com.batterysmart.swap_ledger.driver.Driver;
import com.batterysmart.swap_ledger.driver.DriverService;
import com.batterysmart.swap_ledger.plan.PlanCatalog;
import com.batterysmart.swap_ledger.plan.PlanDefinition;
import com.batterysmart.swap_ledger.plan.SubscriptionPlan;
import com.batterysmart.swap_ledger.station.Station;
import com.batterysmart.swap_ledger.station.StationDefinition;
import com.batterysmart.swap_ledger.station.StationDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Base for tests that run against PostgreSQL and Redis containers.
 *
 * The containers are shared by every subclass and started once. Kafka is
 * pointed at a closed port, the outbox publisher, the station consumer and
 * the scheduled sweeps are off. Tests call the sweeps directly.
 */
@SpringBootTest
@Import(TestClockConfig.class)
public abstract class LedgerIntegrationTest {

    protected static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("swap_ledger_test")
            .withUsername("test")
            .withPassword("test");

    protected static final GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    private static final AtomicInteger PHONE_SEQUENCE = new AtomicInteger();

    static {
        postgres.start();
        redis.start();
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("ledger.penalty.sweep.enabled", () -> "false");
        registry.add("ledger.subscription.expiry-sweep.enabled", () -> "false");
    }

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected DriverService driverService;

    @Autowired
    protected PlanCatalog planCatalog;

    @Autowired
    protected StationDirectory stationDirectory;

    @Autowired
    private StringRedisTemplate redisTemplate;

    @BeforeEach
    void resetLedger() {
        jdbcTemplate.execute("TRUNCATE drivers, stations, dsk_locations, invoice_sequences, " +
            "outbox_events, processed_events CASCADE");
        clock.setDate(TestClockConfig.START_DATE);
        flushCache();
    }

    protected void flushCache() {
        try (RedisConnection connection = redisTemplate.getConnectionFactory().getConnection()) {
            connection.serverCommands().flushAll();
        } catch (Exception e) {
            System.out.println("Redis flush skipped: " + e.getMessage());
        }
    }

    protected Driver registerDriver() {
        String phone = String.format("98%08d", PHONE_SEQUENCE.incrementAndGet());
        return driverService.register(phone, "Driver " + phone, null, "hi-en", "Bengaluru", null).driver();
    }

    protected Station createStation(String code, double latitude, double longitude, int available) {
        stationDirectory.upsert(StationDefinition.builder()
            .code(code)
            .name("Station " + code)
            .latitude(latitude)
            .longitude(longitude)
            .city("Bengaluru")
            .build());
        return stationDirectory.updateInventory(code, available, 2, 20);
    }

    /**
     * A plan with a small quota, no daily cap, Rs.35 extra swaps and 18% GST.
     */
    protected SubscriptionPlan fourSwapPlan() {
        return planCatalog.upsert(PlanDefinition.builder()
            .code("TEST4")
            .name("Four Swap Test Plan")
            .price(new BigDecimal("199.00"))
            .validityDays(30)
            .swapsIncluded(4)
            .swapsPerDay(SubscriptionPlan.UNLIMITED)
            .extraSwapPrice(new BigDecimal("35.00"))
            .gstPercentage(new BigDecimal("18.00"))
            .description("Test plan")
            .active(true)
            .build());
    }

    protected void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    protected void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    protected void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    protected void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }
}
