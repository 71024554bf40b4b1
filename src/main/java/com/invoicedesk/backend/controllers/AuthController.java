package com.invoicedesk.backend.controllers;

import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.invoicedesk.backend.dto.ApiResponse;
import com.invoicedesk.backend.dto.AuthResponseDTO;
import com.invoicedesk.backend.security.JwtAuthenticationFilter;
import com.invoicedesk.backend.services.CredentialExchangeService;
import com.invoicedesk.backend.services.SignInOutcome;
import com.invoicedesk.backend.validation.FormInput;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final CredentialExchangeService credentialExchangeService;

    // campos do formulário: email, password
    @PostMapping("/login")
    public ResponseEntity<ApiResponse<AuthResponseDTO>> login(@RequestParam Map<String, String> form,
                                                              HttpServletResponse response) {
        SignInOutcome outcome = credentialExchangeService.authenticate(FormInput.of(form));

        if (!outcome.succeeded()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ApiResponse.error(outcome.error()));
        }

        AuthResponseDTO session = outcome.session();

        Cookie cookie = new Cookie(JwtAuthenticationFilter.SESSION_COOKIE, session.getToken());
        cookie.setHttpOnly(true);
        cookie.setPath("/");
        cookie.setMaxAge((int) (session.getExpiresIn() / 1000));
        response.addCookie(cookie);

        return ResponseEntity.ok(ApiResponse.success(session, "Signed in"));
    }

    @PostMapping("/logout")
    public ResponseEntity<ApiResponse<Void>> logout(HttpServletResponse response) {
        Cookie cookie = new Cookie(JwtAuthenticationFilter.SESSION_COOKIE, "");
        cookie.setHttpOnly(true);
        cookie.setPath("/");
        cookie.setMaxAge(0);
        response.addCookie(cookie);

        return ResponseEntity.ok(ApiResponse.success(null, "Signed out"));
    }
}
