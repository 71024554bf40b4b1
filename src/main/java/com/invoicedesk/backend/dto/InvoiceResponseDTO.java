package com.invoicedesk.backend.dto;

import com.invoicedesk.backend.enums.InvoiceStatus;
import lombok.Data;

import java.time.LocalDate;

@Data
public class InvoiceResponseDTO {

    private String id;
    private String customerId;
    private Long amount;
    private InvoiceStatus status;
    private LocalDate date;
}
