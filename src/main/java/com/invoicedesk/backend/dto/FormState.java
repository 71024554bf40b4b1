package com.invoicedesk.backend.dto;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Estado devolvido ao formulário: erros por campo e/ou uma mensagem geral.
 * Os nomes dos campos são os mesmos usados no envio do formulário.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FormState {

    private Map<String, List<String>> errors;
    private String message;

    public static FormState empty() {
        return new FormState();
    }

    public static FormState message(String message) {
        return FormState.builder().message(message).build();
    }

    public static FormState invalid(Map<String, List<String>> errors, String message) {
        return FormState.builder().errors(errors).message(message).build();
    }

    public boolean hasFieldErrors() {
        return errors != null && !errors.isEmpty();
    }
}
