package com.invoicedesk.backend.services;

import com.invoicedesk.backend.dto.AuthResponseDTO;

/**
 * Sessão emitida pelo provedor, ou a mensagem a exibir no formulário de login.
 */
public record SignInOutcome(AuthResponseDTO session, String error) {

    public static SignInOutcome signedIn(AuthResponseDTO session) {
        return new SignInOutcome(session, null);
    }

    public static SignInOutcome failed(String error) {
        return new SignInOutcome(null, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
