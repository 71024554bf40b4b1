package com.invoicedesk.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.InternalAuthenticationServiceException;

import com.invoicedesk.backend.dto.AuthResponseDTO;
import com.invoicedesk.backend.security.IdentityProvider;
import com.invoicedesk.backend.validation.FormInput;

@ExtendWith(MockitoExtension.class)
class CredentialExchangeServiceTest {

    @Mock
    private IdentityProvider identityProvider;

    @InjectMocks
    private CredentialExchangeService credentialExchangeService;

    private final FormInput credentials = FormInput.of(Map.of("email", "user@nextmail.com", "password", "123456"));

    @Test
    void authenticate_acceptedCredentials_returnsSession() {
        AuthResponseDTO session = AuthResponseDTO.builder().token("jwt").tokenType("Bearer").expiresIn(1000L).build();
        when(identityProvider.signIn(IdentityProvider.CREDENTIALS, credentials)).thenReturn(session);

        SignInOutcome outcome = credentialExchangeService.authenticate(credentials);

        assertTrue(outcome.succeeded());
        assertSame(session, outcome.session());
        assertNull(outcome.error());
    }

    @Test
    void authenticate_badCredentials_returnsInvalidCredentialsMessage() {
        when(identityProvider.signIn(eq(IdentityProvider.CREDENTIALS), any()))
                .thenThrow(new BadCredentialsException("bad"));

        SignInOutcome outcome = credentialExchangeService.authenticate(credentials);

        assertFalse(outcome.succeeded());
        assertEquals("Invalid credentials.", outcome.error());
    }

    @Test
    void authenticate_otherAuthenticationFailure_returnsGenericMessage() {
        when(identityProvider.signIn(eq(IdentityProvider.CREDENTIALS), any()))
                .thenThrow(new InternalAuthenticationServiceException("db down"));

        SignInOutcome outcome = credentialExchangeService.authenticate(credentials);

        assertEquals("Something went wrong.", outcome.error());
    }

    @Test
    void authenticate_nonAuthenticationFailure_propagates() {
        when(identityProvider.signIn(eq(IdentityProvider.CREDENTIALS), any()))
                .thenThrow(new IllegalStateException("boom"));

        assertThrows(IllegalStateException.class, () -> credentialExchangeService.authenticate(credentials));
    }
}
