package com.invoicedesk.backend.mappers;

import com.invoicedesk.backend.dto.InvoiceResponseDTO;
import com.invoicedesk.backend.entities.Invoice;

public class InvoiceMapper {

    private InvoiceMapper() {
    }

    public static InvoiceResponseDTO toResponseDTO(Invoice invoice) {
        InvoiceResponseDTO dto = new InvoiceResponseDTO();
        dto.setId(invoice.getId());
        dto.setCustomerId(invoice.getCustomerId());
        dto.setAmount(invoice.getAmount());
        dto.setStatus(invoice.getStatus());
        dto.setDate(invoice.getDate());
        return dto;
    }
}
