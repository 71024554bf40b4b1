package com.invoicedesk.backend.enums;

import java.util.Arrays;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InvoiceStatus {
    PENDING("pending"),
    PAID("paid");

    private final String value;

    InvoiceStatus(String value) {
        this.value = value;
    }

    /**
     * Valor gravado na coluna {@code status} e trafegado nos formulários.
     */
    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<InvoiceStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(s -> s.value.equals(value))
                .findFirst();
    }
}
