package com.invoicedesk.backend.validation;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class InvoiceForm {

    public static final String REQUIRED_MESSAGE = "Required";
    public static final String CUSTOMER_MESSAGE = "Please select a customer.";
    public static final String AMOUNT_MESSAGE = "Please enter an amount greater than $0.";
    public static final String AMOUNT_TOO_LARGE_MESSAGE = "Please enter a smaller amount.";
    public static final String STATUS_MESSAGE = "Please select an invoice status.";

    @NotNull(message = REQUIRED_MESSAGE)
    private String id;

    @NotBlank(message = CUSTOMER_MESSAGE)
    private String customerId;

    // valor em unidades maiores (reais/dólares); a conversão para centavos é feita na escrita.
    // 0.005 é o menor valor que arredonda (HALF_UP) para 1 centavo
    @NotNull(message = AMOUNT_MESSAGE)
    @DecimalMin(value = "0.005", message = AMOUNT_MESSAGE)
    @DecimalMax(value = "92233720368547758.07", message = AMOUNT_TOO_LARGE_MESSAGE)
    private BigDecimal amount;

    @NotNull(message = STATUS_MESSAGE)
    @Pattern(regexp = "pending|paid", message = STATUS_MESSAGE)
    private String status;

    @NotNull(message = REQUIRED_MESSAGE)
    private String date;
}
