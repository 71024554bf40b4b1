package com.invoicedesk.backend.validation;

public record CustomerDraft(String name, String email, String imageUrl) {
}
