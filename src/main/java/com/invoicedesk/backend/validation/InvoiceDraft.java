package com.invoicedesk.backend.validation;

import java.math.BigDecimal;
import java.math.RoundingMode;

import com.invoicedesk.backend.enums.InvoiceStatus;

/**
 * Fatura validada, ainda com o valor em unidades maiores.
 */
public record InvoiceDraft(String customerId, BigDecimal amount, InvoiceStatus status) {

    public long amountInMinorUnits() {
        return amount.movePointRight(2)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
    }
}
