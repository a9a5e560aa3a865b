package com.batterysmart.swap_ledger.plan;

import com.batterysmart.swap_ledger.plan.dto.PlanResponse;
import com.batterysmart.swap_ledger.plan.dto.UpsertPlanRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/plans")
@RequiredArgsConstructor
public class PlanController {

    private final PlanCatalog planCatalog;

    @GetMapping
    public List<PlanResponse> listPlans() {
        return planCatalog.listActive().stream()
            .map(PlanResponse::from)
            .toList();
    }

    @GetMapping("/{code}")
    public PlanResponse getPlan(@PathVariable("code") String code) {
        return PlanResponse.from(planCatalog.findByCode(code));
    }

    @PutMapping("/{code}")
    public ResponseEntity<PlanResponse> upsertPlan(@PathVariable("code") String code,
                                                   @Valid @RequestBody UpsertPlanRequest request) {
        SubscriptionPlan plan = planCatalog.upsert(PlanDefinition.builder()
            .code(code)
            .name(request.getName())
            .price(request.getPrice())
            .validityDays(request.getValidityDays())
            .swapsIncluded(request.getSwapsIncluded())
            .swapsPerDay(request.getSwapsPerDay())
            .extraSwapPrice(request.getExtraSwapPrice())
            .gstPercentage(request.getGstPercentage())
            .description(request.getDescription())
            .active(request.getActive() == null || request.getActive())
            .build());
        return ResponseEntity.ok(PlanResponse.from(plan));
    }
}
