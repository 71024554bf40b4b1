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
import com.invoicedesk.backend.dto.CustomerResponseDTO;
import com.invoicedesk.backend.dto.FormState;
import com.invoicedesk.backend.services.CustomerService;
import com.invoicedesk.backend.services.mutations.CustomerMutationService;
import com.invoicedesk.backend.validation.FormInput;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/customers")
@RequiredArgsConstructor
public class CustomerController {

    private final CustomerService customerService;
    private final CustomerMutationService customerMutationService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<CustomerResponseDTO>>> findAll() {
        List<CustomerResponseDTO> list = customerService.findAll();
        return ResponseEntity.ok(ApiResponse.success(list, "Customers found"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<CustomerResponseDTO>> findById(@PathVariable String id) {
        CustomerResponseDTO found = customerService.findById(id);
        return ResponseEntity.ok(ApiResponse.success(found, "Customer found"));
    }

    // campos do formulário: name, email, image_url
    @PostMapping
    public ResponseEntity<ApiResponse<FormState>> create(@RequestParam Map<String, String> form) {
        return MutationResponses.toResponse(
                customerMutationService.createCustomers(FormState.empty(), FormInput.of(form)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<FormState>> update(@PathVariable String id,
                                                         @RequestParam Map<String, String> form) {
        return MutationResponses.toResponse(
                customerMutationService.updateCustomers(id, FormState.empty(), FormInput.of(form)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<FormState>> delete(@PathVariable String id) {
        return MutationResponses.toResponse(customerMutationService.deleteCustomers(id));
    }
}
