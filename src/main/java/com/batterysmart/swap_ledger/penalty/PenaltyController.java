package com.batterysmart.swap_ledger.penalty;

import com.batterysmart.swap_ledger.penalty.dto.DriverPenaltyResponse;
import com.batterysmart.swap_ledger.penalty.dto.PenaltyRecordResponse;
import com.batterysmart.swap_ledger.penalty.dto.PenaltyResponse;
import com.batterysmart.swap_ledger.penalty.dto.SettlePenaltyRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
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
public class PenaltyController {

    private final PenaltyService penaltyService;

    @GetMapping("/subscriptions/{subscriptionId}/penalty")
    public PenaltyResponse getPenalty(@PathVariable("subscriptionId") UUID subscriptionId) {
        return PenaltyResponse.from(penaltyService.getPenalty(subscriptionId));
    }

    @GetMapping("/drivers/{driverId}/penalty")
    public DriverPenaltyResponse getPenaltyForDriver(@PathVariable("driverId") UUID driverId) {
        return DriverPenaltyResponse.from(penaltyService.getPenaltyForDriver(driverId));
    }

    /**
     * 200 with the record, or 204 when nothing is owed.
     */
    @PostMapping("/subscriptions/{subscriptionId}/penalty/assess")
    public ResponseEntity<PenaltyRecordResponse> assess(@PathVariable("subscriptionId") UUID subscriptionId) {
        return penaltyService.assessPenalty(subscriptionId)
            .map(record -> ResponseEntity.ok(PenaltyRecordResponse.from(record)))
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/penalties/{penaltyId}/pay")
    public PenaltyRecordResponse markPaid(@PathVariable("penaltyId") UUID penaltyId,
                                          @Valid @RequestBody SettlePenaltyRequest request) {
        PenaltySettlement settlement = penaltyService.markPaid(penaltyId, request.getActor());
        return PenaltyRecordResponse.from(settlement.getPenalty(), settlement.getInvoice().getInvoiceNumber());
    }

    @PostMapping("/penalties/{penaltyId}/waive")
    public PenaltyRecordResponse waive(@PathVariable("penaltyId") UUID penaltyId,
                                       @Valid @RequestBody SettlePenaltyRequest request) {
        return PenaltyRecordResponse.from(penaltyService.waive(penaltyId, request.getActor()));
    }
}
