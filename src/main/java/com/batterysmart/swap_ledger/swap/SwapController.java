package com.batterysmart.swap_ledger.swap;

import com.batterysmart.swap_ledger.swap.dto.FailSwapRequest;
import com.batterysmart.swap_ledger.swap.dto.RecordSwapRequest;
import com.batterysmart.swap_ledger.swap.dto.SwapHistoryResponse;
import com.batterysmart.swap_ledger.swap.dto.SwapResponse;
import com.batterysmart.swap_ledger.swap.dto.SwapStatusResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Swap recording and history.
 *
 * POST /api/swaps requires an Idempotency-Key header. A repeated key returns
 * the original swap with 200 instead of 201 and writes nothing.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class SwapController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final SwapProcessor swapProcessor;
    private final SwapHistoryService historyService;

    @PostMapping("/swaps")
    public ResponseEntity<SwapResponse> recordSwap(
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
            @Valid @RequestBody RecordSwapRequest request) {
        SwapResult result = swapProcessor.recordSwap(RecordSwapCommand.builder()
            .driverId(request.getDriverId())
            .stationId(request.getStationId())
            .stationCode(request.getStationCode())
            .oldBatteryId(request.getOldBatteryId())
            .newBatteryId(request.getNewBatteryId())
            .oldChargePct(request.getOldChargePct())
            .newChargePct(request.getNewChargePct())
            .idempotencyKey(idempotencyKey)
            .build());

        HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(SwapResponse.from(result));
    }

    @GetMapping("/drivers/{driverId}/swaps")
    public SwapHistoryResponse listSwapHistory(
            @PathVariable("driverId") UUID driverId,
            @RequestParam(value = "period", required = false) String period,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "limit", required = false) Integer limit) {
        HistoryPeriod named = period != null ? HistoryPeriod.fromString(period) : null;
        return SwapHistoryResponse.from(historyService.listSwapHistory(driverId, named, from, to, limit));
    }

    @PostMapping("/swaps/{swapId}/fail")
    public SwapStatusResponse markFailed(@PathVariable("swapId") UUID swapId,
                                         @Valid @RequestBody FailSwapRequest request) {
        return SwapStatusResponse.from(swapProcessor.markFailed(swapId, request.getReason()));
    }

    @PostMapping("/swaps/{swapId}/refund")
    public SwapStatusResponse refund(@PathVariable("swapId") UUID swapId) {
        return SwapStatusResponse.from(swapProcessor.refund(swapId));
    }
}
