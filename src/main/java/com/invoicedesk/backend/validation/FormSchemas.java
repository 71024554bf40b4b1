package com.invoicedesk.backend.validation;

import java.util.List;

import org.springframework.stereotype.Component;
import org.springframework.validation.beanvalidation.SpringValidatorAdapter;

import com.invoicedesk.backend.enums.InvoiceStatus;

import jakarta.validation.Validator;

/**
 * Esquemas base de fatura e cliente e as variantes usadas na criação e na atualização.
 */
@Component
public class FormSchemas {

    private final FormSchema<InvoiceForm, InvoiceDraft> invoice;
    private final FormSchema<CustomerForm, CustomerDraft> customer;

    private final FormSchema<InvoiceForm, InvoiceDraft> createInvoice;
    private final FormSchema<InvoiceForm, InvoiceDraft> updateInvoice;
    private final FormSchema<CustomerForm, CustomerDraft> createCustomer;
    private final FormSchema<CustomerForm, CustomerDraft> updateCustomer;

    public FormSchemas(Validator validator) {
        SpringValidatorAdapter adapter = new SpringValidatorAdapter(validator);

        this.invoice = FormSchema.of(
                "invoice",
                InvoiceForm::new,
                List.of(
                        FormField.of("id", InvoiceForm.REQUIRED_MESSAGE),
                        FormField.of("customerId", InvoiceForm.CUSTOMER_MESSAGE),
                        FormField.of("amount", InvoiceForm.AMOUNT_MESSAGE),
                        FormField.of("status", InvoiceForm.STATUS_MESSAGE),
                        FormField.of("date", InvoiceForm.REQUIRED_MESSAGE)
                ),
                form -> new InvoiceDraft(
                        form.getCustomerId(),
                        form.getAmount(),
                        InvoiceStatus.fromValue(form.getStatus()).orElseThrow()
                ),
                adapter
        );

        this.customer = FormSchema.of(
                "customer",
                CustomerForm::new,
                List.of(
                        FormField.of("id", CustomerForm.REQUIRED_MESSAGE),
                        FormField.of("name", CustomerForm.REQUIRED_MESSAGE),
                        FormField.of("email", CustomerForm.REQUIRED_MESSAGE),
                        new FormField("image_url", "imageUrl", CustomerForm.REQUIRED_MESSAGE)
                ),
                form -> new CustomerDraft(form.getName(), form.getEmail(), form.getImageUrl()),
                adapter
        );

        this.createInvoice = invoice.omit("id", "date");
        this.updateInvoice = invoice.omit("id", "date");
        this.createCustomer = customer.omit("id");
        this.updateCustomer = customer.omit("id");
    }

    public FormSchema<InvoiceForm, InvoiceDraft> invoice() {
        return invoice;
    }

    public FormSchema<CustomerForm, CustomerDraft> customer() {
        return customer;
    }

    public FormSchema<InvoiceForm, InvoiceDraft> createInvoice() {
        return createInvoice;
    }

    public FormSchema<InvoiceForm, InvoiceDraft> updateInvoice() {
        return updateInvoice;
    }

    public FormSchema<CustomerForm, CustomerDraft> createCustomer() {
        return createCustomer;
    }

    public FormSchema<CustomerForm, CustomerDraft> updateCustomer() {
        return updateCustomer;
    }
}
