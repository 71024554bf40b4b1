package com.invoicedesk.backend.security;

import com.invoicedesk.backend.dto.AuthResponseDTO;
import com.invoicedesk.backend.validation.FormInput;

/**
 * Provedor de identidade externo ao pipeline de mutações.
 */
public interface IdentityProvider {

    String CREDENTIALS = "credentials";

    /**
     * Troca as credenciais por uma sessão.
     *
     * @throws org.springframework.security.core.AuthenticationException quando o provedor recusa a tentativa
     */
    AuthResponseDTO signIn(String providerId, FormInput credentials);
}
