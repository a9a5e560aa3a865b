package com.batterysmart.swap_ledger.driver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class UpdateLanguageRequest {

    @NotBlank(message = "Language is required")
    @JsonProperty("preferred_language")
    String preferredLanguage;
}
