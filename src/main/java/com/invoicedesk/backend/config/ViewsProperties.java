package com.invoicedesk.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Caminhos das listagens no front-end. São o alvo dos redirecionamentos após
 * criar/atualizar e a chave usada para invalidar as views em cache.
 */
@ConfigurationProperties(prefix = "invoicedesk.views")
public record ViewsProperties(
        String invoicesPath,
        String customersPath
) {
    public ViewsProperties {
        if (invoicesPath == null || invoicesPath.isBlank()) {
            invoicesPath = "/dashboard/invoices";
        }
        if (customersPath == null || customersPath.isBlank()) {
            customersPath = "/dashboard/customers";
        }
    }

    public static ViewsProperties defaults() {
        return new ViewsProperties(null, null);
    }
}
