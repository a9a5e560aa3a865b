package com.batterysmart.swap_ledger.station;

import com.batterysmart.swap_ledger.exception.InvalidInputException;
import com.batterysmart.swap_ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Array;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Dealer Service Kiosk locations, filterable by city and offered service.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DskDirectory {

    static final int DEFAULT_NEAREST_LIMIT = 3;

    private static final String SELECT_DSK =
        "SELECT d.id, d.code, d.name, d.address, d.landmark, d.latitude, d.longitude, d.city, d.pincode, " +
        "d.phone, d.operating_hours, d.services, d.is_active FROM dsk_locations d ";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    /**
     * Active kiosks, optionally narrowed to a city (substring match) and to
     * those offering a service.
     */
    @Transactional(readOnly = true)
    public List<DskCenter> list(String city, String service) {
        StringBuilder sql = new StringBuilder(SELECT_DSK).append("WHERE d.is_active = TRUE");
        List<Object> args = new ArrayList<>();
        if (city != null && !city.isBlank()) {
            sql.append(" AND LOWER(d.city) LIKE ?");
            args.add(StationDirectory.contains(city));
        }
        if (service != null && !service.isBlank()) {
            sql.append(" AND ? = ANY(d.services)");
            args.add(normalizeService(service));
        }
        sql.append(" ORDER BY d.city, d.code");
        return jdbcTemplate.query(sql.toString(), dskRowMapper(), args.toArray());
    }

    @Transactional(readOnly = true)
    public List<GeoIndex.Ranked<DskCenter>> nearest(double latitude, double longitude, String service, Integer limit) {
        GeoIndex.validateCoordinates(latitude, longitude);
        List<DskCenter> candidates = list(null, service);
        return GeoIndex.nearest(latitude, longitude, candidates,
            StationDirectory.boundedLimit(limit, DEFAULT_NEAREST_LIMIT));
    }

    @Transactional(readOnly = true)
    public DskCenter findByCode(String code) {
        String normalized = normalizeCode(code);
        return jdbcTemplate.query(SELECT_DSK + "WHERE d.code = ?", dskRowMapper(), normalized)
            .stream()
            .findFirst()
            .orElseThrow(() -> new NotFoundException("DSK center", normalized));
    }

    @Transactional
    public DskCenter upsert(DskDefinition definition) {
        String code = normalizeCode(definition.getCode());
        if (definition.getName() == null || definition.getName().isBlank()) {
            throw new InvalidInputException("name", "DSK name is required");
        }
        GeoIndex.validateCoordinates(definition.getLatitude(), definition.getLongitude());
        Timestamp now = Timestamp.from(clock.instant());
        String[] services = definition.getServices().stream()
            .map(DskDirectory::normalizeService)
            .distinct()
            .toArray(String[]::new);

        jdbcTemplate.update(
            "INSERT INTO dsk_locations (id, code, name, address, landmark, latitude, longitude, city, pincode, " +
            "phone, operating_hours, services, is_active, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT (code) DO UPDATE SET name = EXCLUDED.name, address = EXCLUDED.address, " +
            "landmark = EXCLUDED.landmark, latitude = EXCLUDED.latitude, longitude = EXCLUDED.longitude, " +
            "city = EXCLUDED.city, pincode = EXCLUDED.pincode, phone = EXCLUDED.phone, " +
            "operating_hours = EXCLUDED.operating_hours, services = EXCLUDED.services, " +
            "is_active = EXCLUDED.is_active, updated_at = EXCLUDED.updated_at",
            ps -> {
                ps.setObject(1, UUID.randomUUID());
                ps.setString(2, code);
                ps.setString(3, definition.getName());
                ps.setString(4, definition.getAddress());
                ps.setString(5, definition.getLandmark());
                ps.setDouble(6, definition.getLatitude());
                ps.setDouble(7, definition.getLongitude());
                ps.setString(8, definition.getCity());
                ps.setString(9, definition.getPincode());
                ps.setString(10, definition.getPhone());
                ps.setString(11, definition.getOperatingHours());
                ps.setArray(12, ps.getConnection().createArrayOf("text", services));
                ps.setBoolean(13, definition.isActive());
                ps.setTimestamp(14, now);
                ps.setTimestamp(15, now);
            });

        log.info("Upserted DSK center {} offering {}", code, Arrays.toString(services));
        return findByCode(code);
    }

    private RowMapper<DskCenter> dskRowMapper() {
        return (rs, rowNum) -> {
            Array servicesArray = rs.getArray("services");
            List<String> services = servicesArray == null
                ? List.of()
                : List.of((String[]) servicesArray.getArray());
            return new DskCenter(
                rs.getObject("id", UUID.class),
                rs.getString("code"),
                rs.getString("name"),
                rs.getString("address"),
                rs.getString("landmark"),
                rs.getDouble("latitude"),
                rs.getDouble("longitude"),
                rs.getString("city"),
                rs.getString("pincode"),
                rs.getString("phone"),
                rs.getString("operating_hours"),
                services,
                rs.getBoolean("is_active")
            );
        };
    }

    private static String normalizeService(String service) {
        return service.trim().toLowerCase(Locale.ROOT);
    }

    private static String normalizeCode(String code) {
        if (code == null || code.isBlank()) {
            throw new InvalidInputException("code", "DSK code is required");
        }
        return code.trim().toUpperCase(Locale.ROOT);
    }
}
