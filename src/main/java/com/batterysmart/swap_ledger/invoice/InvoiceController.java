package com.batterysmart.swap_ledger.invoice;

import com.batterysmart.swap_ledger.invoice.dto.InvoiceExplanationResponse;
import com.batterysmart.swap_ledger.invoice.dto.InvoiceResponse;
import com.batterysmart.swap_ledger.invoice.dto.UpdatePaymentStatusRequest;
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
import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class InvoiceController {

    private final InvoiceService invoiceService;

    @GetMapping("/invoices/{invoiceNumber}")
    public InvoiceResponse getInvoice(@PathVariable("invoiceNumber") String invoiceNumber) {
        return InvoiceResponse.from(invoiceService.findByNumber(invoiceNumber));
    }

    @PutMapping("/invoices/{invoiceNumber}/payment-status")
    public InvoiceResponse updatePaymentStatus(@PathVariable("invoiceNumber") String invoiceNumber,
                                               @Valid @RequestBody UpdatePaymentStatusRequest request) {
        return InvoiceResponse.from(invoiceService.updatePaymentStatus(invoiceNumber, request.getPaymentStatus()));
    }

    @GetMapping("/drivers/{driverId}/invoices")
    public List<InvoiceResponse> listInvoices(@PathVariable("driverId") UUID driverId,
                                              @RequestParam(value = "limit", defaultValue = "20") int limit) {
        return invoiceService.listForDriver(driverId, limit).stream()
            .map(InvoiceResponse::from)
            .toList();
    }

    /**
     * Explains one invoice, or the driver's latest when no number is given.
     */
    @GetMapping("/drivers/{driverId}/invoices/explanation")
    public InvoiceExplanationResponse explain(@PathVariable("driverId") UUID driverId,
                                              @RequestParam(value = "invoice_number", required = false) String invoiceNumber) {
        return InvoiceExplanationResponse.from(invoiceService.explain(driverId, invoiceNumber));
    }
}
