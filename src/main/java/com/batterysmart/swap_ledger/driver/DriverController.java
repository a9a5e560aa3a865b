package com.batterysmart.swap_ledger.driver;

import com.batterysmart.swap_ledger.driver.dto.DriverResponse;
import com.batterysmart.swap_ledger.driver.dto.RegisterDriverRequest;
import com.batterysmart.swap_ledger.driver.dto.UpdateLanguageRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/drivers")
@RequiredArgsConstructor
public class DriverController {

    private final DriverService driverService;

    @GetMapping("/{phone}")
    public DriverResponse getDriver(@PathVariable("phone") String phone) {
        return DriverResponse.from(driverService.getDriver(phone));
    }

    /**
     * 201 for a new driver, 200 when the phone number was already registered.
     */
    @PostMapping
    public ResponseEntity<DriverResponse> register(@Valid @RequestBody RegisterDriverRequest request) {
        DriverService.RegistrationResult result = driverService.register(
            request.getPhoneNumber(),
            request.getName(),
            request.getEmail(),
            request.getPreferredLanguage(),
            request.getCity(),
            request.getVehicleNumber()
        );
        return ResponseEntity
            .status(result.created() ? HttpStatus.CREATED : HttpStatus.OK)
            .body(DriverResponse.from(result.driver()));
    }

    @PutMapping("/{phone}/language")
    public DriverResponse updateLanguage(@PathVariable("phone") String phone,
                                         @Valid @RequestBody UpdateLanguageRequest request) {
        return DriverResponse.from(driverService.updateLanguage(phone, request.getPreferredLanguage()));
    }

    @PostMapping("/id/{driverId}/deactivate")
    public DriverResponse deactivate(@PathVariable("driverId") UUID driverId) {
        return DriverResponse.from(driverService.deactivate(driverId));
    }
}
