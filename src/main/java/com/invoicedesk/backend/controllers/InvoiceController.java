package com.invoicedesk.backend.controllers;

import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.invoicedesk.backend.dto.ApiResponse;
import com.invoicedesk.backend.dto.FormState;
import com.invoicedesk.backend.dto.InvoiceResponseDTO;
import com.invoicedesk.backend.services.InvoiceService;
import com.invoicedesk.backend.services.mutations.InvoiceMutationService;
import com.invoicedesk.backend.validation.FormInput;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/invoices")
@RequiredArgsConstructor
public class InvoiceController {

    private final InvoiceService invoiceService;
    private final InvoiceMutationService invoiceMutationService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<InvoiceResponseDTO>>> findAll() {
        List<InvoiceResponseDTO> list = invoiceService.findAll();
        return ResponseEntity.ok(ApiResponse.success(list, "Invoices found"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<InvoiceResponseDTO>> findById(@PathVariable String id) {
        InvoiceResponseDTO found = invoiceService.findById(id);
        return ResponseEntity.ok(ApiResponse.success(found, "Invoice found"));
    }

    // campos do formulário: customerId, amount, status
    @PostMapping
    public ResponseEntity<ApiResponse<FormState>> create(@RequestParam Map<String, String> form) {
        return MutationResponses.toResponse(
                invoiceMutationService.createInvoice(FormState.empty(), FormInput.of(form)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<FormState>> update(@PathVariable String id,
                                                         @RequestParam Map<String, String> form) {
        return MutationResponses.toResponse(
                invoiceMutationService.updateInvoice(id, FormState.empty(), FormInput.of(form)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<FormState>> delete(@PathVariable String id) {
        return MutationResponses.toResponse(invoiceMutationService.deleteInvoice(id));
    }
}
