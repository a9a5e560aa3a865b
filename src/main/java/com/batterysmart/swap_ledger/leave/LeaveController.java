package com.batterysmart.swap_ledger.leave;

import com.batterysmart.swap_ledger.leave.dto.LeaveDecisionRequest;
import com.batterysmart.swap_ledger.leave.dto.LeaveRequestBody;
import com.batterysmart.swap_ledger.leave.dto.LeaveRequestResponse;
import com.batterysmart.swap_ledger.leave.dto.LeaveSummaryResponse;
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
public class LeaveController {

    private final LeaveService leaveService;

    @PostMapping("/drivers/{driverId}/leaves")
    public ResponseEntity<LeaveRequestResponse> requestLeave(@PathVariable("driverId") UUID driverId,
                                                             @Valid @RequestBody LeaveRequestBody body) {
        LeaveRequest request = leaveService.requestLeave(driverId, body.getStartDate(), body.getEndDate(),
            body.getReason());
        return ResponseEntity.status(HttpStatus.CREATED).body(LeaveRequestResponse.from(request));
    }

    @GetMapping("/drivers/{driverId}/leaves/summary")
    public LeaveSummaryResponse getLeaveSummary(@PathVariable("driverId") UUID driverId) {
        return LeaveSummaryResponse.from(leaveService.getLeaveSummary(driverId));
    }

    @GetMapping("/leaves/{requestId}")
    public LeaveRequestResponse getRequest(@PathVariable("requestId") UUID requestId) {
        return LeaveRequestResponse.from(leaveService.getRequest(requestId));
    }

    @PostMapping("/leaves/{requestId}/approve")
    public LeaveRequestResponse approve(@PathVariable("requestId") UUID requestId,
                                        @Valid @RequestBody LeaveDecisionRequest request) {
        return LeaveRequestResponse.from(leaveService.approve(requestId, request.getActor()));
    }

    @PostMapping("/leaves/{requestId}/reject")
    public LeaveRequestResponse reject(@PathVariable("requestId") UUID requestId,
                                       @Valid @RequestBody LeaveDecisionRequest request) {
        return LeaveRequestResponse.from(leaveService.reject(requestId, request.getActor()));
    }
}
