package com.invoicedesk.backend.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

/**
 * Resultado de {@link FormSchema#safeParse(FormInput)}: o valor tipado ou os erros por campo.
 * A mensagem geral do formulário fica a cargo de quem chamou (ver {@code FormState}).
 */
@Getter
public final class ValidationResult<T> {

    private final T value;
    private final Map<String, List<String>> fieldErrors;

    private ValidationResult(T value, Map<String, List<String>> fieldErrors) {
        this.value = value;
        this.fieldErrors = fieldErrors;
    }

    public static <T> ValidationResult<T> valid(T value) {
        return new ValidationResult<>(value, Map.of());
    }

    public static <T> ValidationResult<T> invalid(Map<String, List<String>> fieldErrors) {
        return new ValidationResult<>(null, Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors)));
    }

    public boolean isValid() {
        return fieldErrors.isEmpty();
    }
}
