package com.invoicedesk.backend.entities.converters;

import com.invoicedesk.backend.enums.InvoiceStatus;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class InvoiceStatusConverter implements AttributeConverter<InvoiceStatus, String> {

    @Override
    public String convertToDatabaseColumn(InvoiceStatus status) {
        return status != null ? status.getValue() : null;
    }

    @Override
    public InvoiceStatus convertToEntityAttribute(String column) {
        if (column == null) {
            return null;
        }
        return InvoiceStatus.fromValue(column)
                .orElseThrow(() -> new IllegalStateException("Status de fatura desconhecido: " + column));
    }
}
