package com.invoicedesk.backend.validation;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

// TODO: name/email/image_url aceitam string vazia; confirmar com produto antes de exigir tamanho mínimo e formato de e-mail
@Data
public class CustomerForm {

    public static final String REQUIRED_MESSAGE = "Required";

    @NotNull(message = REQUIRED_MESSAGE)
    private String id;

    @NotNull(message = REQUIRED_MESSAGE)
    private String name;

    @NotNull(message = REQUIRED_MESSAGE)
    private String email;

    @NotNull(message = REQUIRED_MESSAGE)
    private String imageUrl;
}
