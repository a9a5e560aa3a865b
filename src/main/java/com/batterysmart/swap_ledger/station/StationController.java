package com.batterysmart.swap_ledger.station;

import com.batterysmart.swap_ledger.station.dto.StationResponse;
import com.batterysmart.swap_ledger.station.dto.UpdateInventoryRequest;
import com.batterysmart.swap_ledger.station.dto.UpsertStationRequest;
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

@RestController
@RequestMapping("/api/stations")
@RequiredArgsConstructor
public class StationController {

    private final StationDirectory stationDirectory;

    @GetMapping("/nearby")
    public List<StationResponse> findNearby(
            @RequestParam("lat") double latitude,
            @RequestParam("lon") double longitude,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "min_available", required = false) Integer minAvailable,
            @RequestParam(value = "dsk_only", defaultValue = "false") boolean dskOnly) {
        return stationDirectory.findNearby(latitude, longitude, limit, minAvailable, dskOnly).stream()
            .map(StationResponse::from)
            .toList();
    }

    @GetMapping("/search")
    public List<StationResponse> search(@RequestParam("q") String term,
                                        @RequestParam(value = "limit", required = false) Integer limit) {
        return stationDirectory.search(term, limit).stream()
            .map(StationResponse::from)
            .toList();
    }

    @GetMapping
    public List<StationResponse> listByCity(@RequestParam("city") String city,
                                            @RequestParam(value = "limit", required = false) Integer limit) {
        return stationDirectory.listByCity(city, limit).stream()
            .map(StationResponse::from)
            .toList();
    }

    /**
     * Accepts a station code or part of its name.
     */
    @GetMapping("/availability")
    public StationResponse availability(@RequestParam("station") String identifier) {
        return StationResponse.from(stationDirectory.availability(identifier));
    }

    @GetMapping("/{code}")
    public StationResponse getStation(@PathVariable("code") String code) {
        return StationResponse.from(stationDirectory.findByCode(code));
    }

    @PutMapping("/{code}")
    public StationResponse upsert(@PathVariable("code") String code,
                                  @Valid @RequestBody UpsertStationRequest request) {
        StationDefinition.StationDefinitionBuilder definition = StationDefinition.builder()
            .code(code)
            .name(request.getName())
            .address(request.getAddress())
            .landmark(request.getLandmark())
            .latitude(request.getLatitude())
            .longitude(request.getLongitude())
            .city(request.getCity())
            .pincode(request.getPincode())
            .contactPhone(request.getContactPhone())
            .dsk(Boolean.TRUE.equals(request.getDsk()))
            .googleMapUrl(request.getGoogleMapUrl());
        if (request.getOperatingHours() != null) {
            definition.operatingHours(request.getOperatingHours());
        }
        if (request.getActive() != null) {
            definition.active(request.getActive());
        }
        return StationResponse.from(stationDirectory.upsert(definition.build()));
    }

    @PutMapping("/{code}/inventory")
    public StationResponse updateInventory(@PathVariable("code") String code,
                                           @Valid @RequestBody UpdateInventoryRequest request) {
        return StationResponse.from(stationDirectory.updateInventory(code,
            request.getAvailableBatteries(), request.getChargingBatteries(), request.getTotalSlots()));
    }
}
