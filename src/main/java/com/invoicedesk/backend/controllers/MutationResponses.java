package com.invoicedesk.backend.controllers;

import java.net.URI;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import com.invoicedesk.backend.dto.ApiResponse;
import com.invoicedesk.backend.dto.FormState;
import com.invoicedesk.backend.services.mutations.MutationOutcome;

/**
 * Traduz um {@link MutationOutcome} em resposta HTTP.
 *
 * <p>REDIRECT → 303 com Location; SUCCESS → 200; FAILURE → 400 (erros de campo) ou 500 (banco);
 * REJECTED → 409.
 */
final class MutationResponses {

    private MutationResponses() {
    }

    static ResponseEntity<ApiResponse<FormState>> toResponse(MutationOutcome outcome) {
        return switch (outcome.getKind()) {
            case REDIRECT -> ResponseEntity.status(HttpStatus.SEE_OTHER)
                    .location(URI.create(outcome.getTarget()))
                    .build();
            case SUCCESS -> ResponseEntity.ok(ApiResponse.success(outcome.getState(), outcome.getMessage()));
            case FAILURE -> ResponseEntity
                    .status(outcome.getState().hasFieldErrors() ? HttpStatus.BAD_REQUEST : HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ApiResponse.failure(outcome.getState(), outcome.getMessage()));
            case REJECTED -> ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(ApiResponse.failure(outcome.getState(), outcome.getMessage()));
        };
    }
}
