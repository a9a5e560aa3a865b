package com.batterysmart.swap_ledger.station;

import com.batterysmart.swap_ledger.station.dto.DskCenterResponse;
import com.batterysmart.swap_ledger.station.dto.UpsertDskRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Driver Seva Kendra (service kiosk) lookup.
 */
@RestController
@RequestMapping("/api/dsk-centers")
@RequiredArgsConstructor
public class DskController {

    private final DskDirectory dskDirectory;

    @GetMapping
    public List<DskCenterResponse> list(@RequestParam(value = "city", required = false) String city,
                                        @RequestParam(value = "service", required = false) String service) {
        return dskDirectory.list(city, service).stream()
            .map(DskCenterResponse::from)
            .toList();
    }

    @GetMapping("/nearest")
    public List<DskCenterResponse> nearest(@RequestParam("lat") double latitude,
                                           @RequestParam("lon") double longitude,
                                           @RequestParam(value = "service", required = false) String service,
                                           @RequestParam(value = "limit", required = false) Integer limit) {
        return dskDirectory.nearest(latitude, longitude, service, limit).stream()
            .map(DskCenterResponse::from)
            .toList();
    }

    @GetMapping("/{code}")
    public DskCenterResponse get(@PathVariable("code") String code) {
        return DskCenterResponse.from(dskDirectory.findByCode(code));
    }

    @PutMapping("/{code}")
    public DskCenterResponse upsert(@PathVariable("code") String code,
                                    @Valid @RequestBody UpsertDskRequest request) {
        DskDefinition.DskDefinitionBuilder definition = DskDefinition.builder()
            .code(code)
            .name(request.getName())
            .address(request.getAddress())
            .landmark(request.getLandmark())
            .latitude(request.getLatitude())
            .longitude(request.getLongitude())
            .city(request.getCity())
            .pincode(request.getPincode())
            .phone(request.getPhone());
        if (request.getServices() != null) {
            definition.services(request.getServices());
        }
        if (request.getOperatingHours() != null) {
            definition.operatingHours(request.getOperatingHours());
        }
        if (request.getActive() != null) {
            definition.active(request.getActive());
        }
        return DskCenterResponse.from(dskDirectory.upsert(definition.build()));
    }
}
