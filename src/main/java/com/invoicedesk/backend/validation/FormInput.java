package com.invoicedesk.backend.validation;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Campos crus de um envio de formulário. Qualquer campo pode estar ausente.
 */
public final class FormInput {

    private final Map<String, String> values;

    private FormInput(Map<String, String> values) {
        this.values = values;
    }

    public static FormInput of(Map<String, String> values) {
        return new FormInput(values == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(values)));
    }

    public static FormInput empty() {
        return new FormInput(Map.of());
    }

    public String get(String field) {
        return values.get(field);
    }

    @Override
    public String toString() {
        return "FormInput" + values.keySet();
    }
}
