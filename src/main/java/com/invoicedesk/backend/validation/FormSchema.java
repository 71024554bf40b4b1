package com.invoicedesk.backend.validation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

import org.springframework.beans.MutablePropertyValues;
import org.springframework.validation.BindingResult;
import org.springframework.validation.DataBinder;
import org.springframework.validation.FieldError;
import org.springframework.validation.Validator;

/**
 * Esquema declarativo de um formulário.
 *
 * <p>Os valores crus são ligados a um objeto de formulário anotado com Bean Validation
 * via {@link DataBinder}: falhas de conversão viram erros de campo, e as constraints
 * são avaliadas em seguida. Variantes do mesmo esquema são obtidas com {@link #omit(String...)};
 * campos omitidos não são lidos da entrada e suas violações são descartadas.
 *
 * <p>{@code safeParse} nunca lança exceção por causa da entrada.
 *
 * @param <F> objeto de formulário (mutável, com setters)
 * @param <T> valor tipado produzido quando a entrada é válida
 */
public final class FormSchema<F, T> {

    private final String objectName;
    private final Supplier<F> formFactory;
    private final List<FormField> fields;
    private final Set<String> omitted;
    private final Function<F, T> toValue;
    private final Validator validator;

    private FormSchema(
            String objectName,
            Supplier<F> formFactory,
            List<FormField> fields,
            Set<String> omitted,
            Function<F, T> toValue,
            Validator validator
    ) {
        this.objectName = objectName;
        this.formFactory = formFactory;
        this.fields = List.copyOf(fields);
        this.omitted = Set.copyOf(omitted);
        this.toValue = toValue;
        this.validator = validator;
    }

    public static <F, T> FormSchema<F, T> of(
            String objectName,
            Supplier<F> formFactory,
            List<FormField> fields,
            Function<F, T> toValue,
            Validator validator
    ) {
        return new FormSchema<>(objectName, formFactory, fields, Set.of(), toValue, validator);
    }

    /**
     * Nova variante sem os campos informados (ex.: id e data atribuídos pelo sistema).
     */
    public FormSchema<F, T> omit(String... fieldNames) {
        Set<String> names = new HashSet<>(omitted);
        for (String name : fieldNames) {
            boolean known = fields.stream().anyMatch(f -> f.name().equals(name));
            if (!known) {
                throw new IllegalArgumentException("Campo desconhecido no esquema " + objectName + ": " + name);
            }
            names.add(name);
        }
        return new FormSchema<>(objectName, formFactory, fields, names, toValue, validator);
    }

    public List<String> fieldNames() {
        return activeFields().stream().map(FormField::name).toList();
    }

    public ValidationResult<T> safeParse(FormInput input) {
        List<FormField> active = activeFields();
        F target = formFactory.get();

        DataBinder binder = new DataBinder(target, objectName);
        binder.setAllowedFields(active.stream().map(FormField::property).toArray(String[]::new));
        binder.setValidator(validator);

        MutablePropertyValues values = new MutablePropertyValues();
        for (FormField field : active) {
            values.add(field.property(), input.get(field.name()));
        }

        binder.bind(values);
        binder.validate();

        Map<String, List<String>> errors = collectErrors(binder.getBindingResult(), active);
        if (!errors.isEmpty()) {
            return ValidationResult.invalid(errors);
        }
        return ValidationResult.valid(toValue.apply(target));
    }

    private List<FormField> activeFields() {
        return fields.stream()
                .filter(f -> !omitted.contains(f.name()))
                .toList();
    }

    // ordem dos campos = ordem da declaração; mensagens repetidas são colapsadas
    private Map<String, List<String>> collectErrors(BindingResult result, List<FormField> active) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        for (FormField field : active) {
            Set<String> messages = new LinkedHashSet<>();
            for (FieldError error : result.getFieldErrors(field.property())) {
                messages.add(error.isBindingFailure() ? field.invalidMessage() : error.getDefaultMessage());
            }
            if (!messages.isEmpty()) {
                errors.put(field.name(), new ArrayList<>(messages));
            }
        }
        return errors;
    }

    @Override
    public String toString() {
        return "FormSchema[" + objectName + ", fields=" + fieldNames() + ", omitted=" + Arrays.toString(omitted.toArray()) + "]";
    }
}
