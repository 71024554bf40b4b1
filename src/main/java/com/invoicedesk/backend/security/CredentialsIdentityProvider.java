package com.invoicedesk.backend.security;

import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.ProviderNotFoundException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;

import com.invoicedesk.backend.dto.AuthResponseDTO;
import com.invoicedesk.backend.validation.FormInput;

import lombok.RequiredArgsConstructor;

/**
 * E-mail e senha contra a tabela de usuários; emite um JWT quando a senha confere.
 */
@Component
@RequiredArgsConstructor
public class CredentialsIdentityProvider implements IdentityProvider {

    private final AuthenticationManager authenticationManager;
    private final JwtService jwtService;

    @Override
    public AuthResponseDTO signIn(String providerId, FormInput credentials) {
        if (!CREDENTIALS.equals(providerId)) {
            throw new ProviderNotFoundException("Provedor de identidade não suportado: " + providerId);
        }

        String email = normalizeEmail(credentials.get("email"));
        String password = credentials.get("password");
        if (email == null || email.isBlank() || password == null || password.isEmpty()) {
            throw new BadCredentialsException("Credenciais ausentes");
        }

        Authentication authentication = authenticationManager.authenticate(
                UsernamePasswordAuthenticationToken.unauthenticated(email, password));
        CustomUserDetails principal = (CustomUserDetails) authentication.getPrincipal();

        return AuthResponseDTO.builder()
                .token(jwtService.generateToken(principal))
                .tokenType("Bearer")
                .expiresIn(jwtService.getExpirationMillis())
                .build();
    }

    private String normalizeEmail(String email) {
        if (email == null) return null;
        return email.trim().toLowerCase();
    }
}
