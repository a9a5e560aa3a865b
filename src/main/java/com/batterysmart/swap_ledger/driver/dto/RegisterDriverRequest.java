package com.batterysmart.swap_ledger.driver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class RegisterDriverRequest {

    @NotBlank(message = "Phone number is required")
    @JsonProperty("phone_number")
    String phoneNumber;

    @Size(max = 100)
    @JsonProperty("name")
    String name;

    @Email
    @JsonProperty("email")
    String email;

    @JsonProperty("preferred_language")
    String preferredLanguage;

    @Size(max = 100)
    @JsonProperty("city")
    String city;

    @Size(max = 20)
    @JsonProperty("vehicle_number")
    String vehicleNumber;
}
