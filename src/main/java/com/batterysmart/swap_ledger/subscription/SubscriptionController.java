package com.batterysmart.swap_ledger.subscription;

import com.batterysmart.swap_ledger.subscription.dto.CustodyRequest;
import com.batterysmart.swap_ledger.subscription.dto.EntitlementResponse;
import com.batterysmart.swap_ledger.subscription.dto.ResetUsageRequest;
import com.batterysmart.swap_ledger.subscription.dto.ReturnBatteryRequest;
import com.batterysmart.swap_ledger.subscription.dto.SubscribeRequest;
import com.batterysmart.swap_ledger.subscription.dto.SubscriptionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SubscriptionController {

    private final EntitlementStore entitlementStore;
    private final SubscriptionService subscriptionService;

    @GetMapping("/drivers/{driverId}/entitlement")
    public EntitlementResponse getEntitlement(@PathVariable("driverId") UUID driverId) {
        return EntitlementResponse.from(entitlementStore.getActiveEntitlement(driverId));
    }

    @PostMapping("/drivers/{driverId}/subscriptions")
    public ResponseEntity<SubscriptionResponse> subscribe(@PathVariable("driverId") UUID driverId,
                                                          @Valid @RequestBody SubscribeRequest request) {
        SubscriptionResult result = subscriptionService.subscribe(
            driverId, request.getPlanCode(), Boolean.TRUE.equals(request.getAutoRenew()));
        return ResponseEntity.status(HttpStatus.CREATED).body(SubscriptionResponse.from(result));
    }

    @GetMapping("/subscriptions/{subscriptionId}")
    public SubscriptionResponse getSubscription(@PathVariable("subscriptionId") UUID subscriptionId) {
        return SubscriptionResponse.from(entitlementStore.getSubscription(subscriptionId));
    }

    @PostMapping("/subscriptions/{subscriptionId}/cancel")
    public SubscriptionResponse cancel(@PathVariable("subscriptionId") UUID subscriptionId) {
        return SubscriptionResponse.from(subscriptionService.cancel(subscriptionId));
    }

    @PostMapping("/subscriptions/{subscriptionId}/suspend")
    public SubscriptionResponse suspend(@PathVariable("subscriptionId") UUID subscriptionId) {
        return SubscriptionResponse.from(subscriptionService.suspend(subscriptionId));
    }

    @PostMapping("/subscriptions/{subscriptionId}/resume")
    public SubscriptionResponse resume(@PathVariable("subscriptionId") UUID subscriptionId) {
        return SubscriptionResponse.from(subscriptionService.resume(subscriptionId));
    }

    @PostMapping("/subscriptions/{subscriptionId}/reset-usage")
    public SubscriptionResponse resetUsage(@PathVariable("subscriptionId") UUID subscriptionId,
                                           @Valid @RequestBody ResetUsageRequest request) {
        return SubscriptionResponse.from(subscriptionService.resetUsage(subscriptionId, request.getActor()));
    }

    @PostMapping("/subscriptions/{subscriptionId}/custody")
    public SubscriptionResponse assignBattery(@PathVariable("subscriptionId") UUID subscriptionId,
                                              @Valid @RequestBody CustodyRequest request) {
        return SubscriptionResponse.from(entitlementStore.setCustody(subscriptionId, request.getBatteryId()));
    }

    @PostMapping("/subscriptions/{subscriptionId}/return")
    public SubscriptionResponse returnBattery(@PathVariable("subscriptionId") UUID subscriptionId,
                                              @RequestBody(required = false) ReturnBatteryRequest request) {
        return SubscriptionResponse.from(entitlementStore.markReturned(
            subscriptionId, request != null ? request.getReturnedAt() : null));
    }

    @PostMapping("/subscriptions/{subscriptionId}/misplaced")
    public SubscriptionResponse reportMisplaced(@PathVariable("subscriptionId") UUID subscriptionId) {
        return SubscriptionResponse.from(entitlementStore.markMisplaced(subscriptionId));
    }
}
