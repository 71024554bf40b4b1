package com.invoicedesk.backend.entities;

import com.invoicedesk.backend.enums.InvoiceStatus;
import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDate;

@Entity
@Table(name = "invoices", indexes = {
        @Index(name = "idx_invoice_customer_status", columnList = "customer_id, status")
})
@Data
public class Invoice {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "customer_id", nullable = false)
    private String customerId;

    // centavos
    @Column(nullable = false)
    private Long amount;

    @Column(nullable = false)
    private InvoiceStatus status;

    @Column(name = "date", nullable = false)
    private LocalDate date;
}
