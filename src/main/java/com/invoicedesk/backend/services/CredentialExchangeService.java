package com.invoicedesk.backend.services;

import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.stereotype.Service;

import com.invoicedesk.backend.dto.AuthResponseDTO;
import com.invoicedesk.backend.security.IdentityProvider;
import com.invoicedesk.backend.validation.FormInput;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Delega a tentativa de login ao {@link IdentityProvider} e traduz as recusas conhecidas
 * em mensagens fixas. Qualquer outra exceção sobe sem alteração.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialExchangeService {

    static final String INVALID_CREDENTIALS = "Invalid credentials.";
    static final String GENERIC_FAILURE = "Something went wrong.";

    private final IdentityProvider identityProvider;

    public SignInOutcome authenticate(FormInput credentials) {
        try {
            AuthResponseDTO session = identityProvider.signIn(IdentityProvider.CREDENTIALS, credentials);
            return SignInOutcome.signedIn(session);
        } catch (BadCredentialsException e) {
            return SignInOutcome.failed(INVALID_CREDENTIALS);
        } catch (AuthenticationException e) {
            log.warn("Login recusado pelo provedor: {}", e.getClass().getSimpleName());
            return SignInOutcome.failed(GENERIC_FAILURE);
        }
    }
}
