package com.batterysmart.swap_ledger.plan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class UpsertPlanRequest {

    @NotBlank(message = "Plan name is required")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Price is required")
    @DecimalMin(value = "0.00", message = "Price cannot be negative")
    @JsonProperty("price")
    BigDecimal price;

    @Min(value = 1, message = "Validity must be at least one day")
    @JsonProperty("validity_days")
    int validityDays;

    @Min(value = -1, message = "Use -1 for unlimited swaps")
    @JsonProperty("swaps_included")
    int swapsIncluded;

    @Min(value = -1, message = "Use -1 for no daily cap")
    @JsonProperty("swaps_per_day")
    int swapsPerDay;

    @NotNull(message = "Extra swap price is required")
    @DecimalMin(value = "0.00", message = "Extra swap price cannot be negative")
    @JsonProperty("extra_swap_price")
    BigDecimal extraSwapPrice;

    @NotNull(message = "GST percentage is required")
    @DecimalMin(value = "0.00", message = "GST percentage cannot be negative")
    @JsonProperty("gst_percentage")
    BigDecimal gstPercentage;

    @JsonProperty("description")
    String description;

    @JsonProperty("active")
    Boolean active;
}
