package com.invoicedesk.backend.services.mutations;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import com.invoicedesk.backend.config.ViewsProperties;
import com.invoicedesk.backend.dto.FormState;
import com.invoicedesk.backend.entities.Customer;
import com.invoicedesk.backend.enums.InvoiceStatus;
import com.invoicedesk.backend.repositories.CustomerRepository;
import com.invoicedesk.backend.repositories.InvoiceRepository;
import com.invoicedesk.backend.services.ViewCacheInvalidator;
import com.invoicedesk.backend.validation.CustomerDraft;
import com.invoicedesk.backend.validation.FormInput;
import com.invoicedesk.backend.validation.FormSchemas;
import com.invoicedesk.backend.validation.ValidationResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Criação, atualização e exclusão de clientes. A exclusão é barrada enquanto o
 * cliente tiver faturas pendentes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CustomerMutationService {

    static final String PENDING_INVOICES_MESSAGE = "no se elimino";

    private final FormSchemas schemas;
    private final CustomerRepository customerRepository;
    private final InvoiceRepository invoiceRepository;
    private final ViewCacheInvalidator viewCacheInvalidator;
    private final ViewsProperties views;

    /**
     * @param prevState estado anterior do formulário; não é consultado
     */
    public MutationOutcome createCustomers(FormState prevState, FormInput form) {
        ValidationResult<CustomerDraft> validated = schemas.createCustomer().safeParse(form);
        if (!validated.isValid()) {
            return MutationOutcome.failure(
                    FormState.invalid(validated.getFieldErrors(), "Missing Fields. Failed to Create Customers."));
        }

        CustomerDraft draft = validated.getValue();

        Customer customer = new Customer();
        customer.setName(draft.name());
        customer.setEmail(draft.email());
        customer.setImageUrl(draft.imageUrl());

        try {
            customerRepository.save(customer);
        } catch (DataAccessException | TransactionException e) {
            log.error("Erro ao criar cliente", e);
            return MutationOutcome.failure(StorageErrors.describe("Create Customers", e));
        }

        viewCacheInvalidator.revalidatePath(views.customersPath());
        return MutationOutcome.redirect(views.customersPath());
    }

    /**
     * @param prevState estado anterior do formulário; não é consultado
     */
    public MutationOutcome updateCustomers(String id, FormState prevState, FormInput form) {
        ValidationResult<CustomerDraft> validated = schemas.updateCustomer().safeParse(form);
        if (!validated.isValid()) {
            return MutationOutcome.failure(
                    FormState.invalid(validated.getFieldErrors(), "Missing Fields. Failed to Update customers."));
        }

        CustomerDraft draft = validated.getValue();

        try {
            int updated = customerRepository.updateCustomer(id, draft.name(), draft.email(), draft.imageUrl());
            if (updated == 0) {
                log.debug("Atualização do cliente {} não encontrou linhas", id);
            }
        } catch (DataAccessException | TransactionException e) {
            log.error("Erro ao atualizar cliente {}", id, e);
            return MutationOutcome.failure(StorageErrors.describe("Update customers", e));
        }

        viewCacheInvalidator.revalidatePath(views.customersPath());
        return MutationOutcome.redirect(views.customersPath());
    }

    /**
     * Exclusão protegida. A contagem de faturas pendentes roda antes de qualquer DELETE;
     * o próprio DELETE repete a condição, então uma fatura pendente criada entre os dois
     * comandos também resulta em rejeição.
     */
    public MutationOutcome deleteCustomers(String id) {
        try {
            long pendingInvoices = invoiceRepository.countByCustomerIdAndStatus(id, InvoiceStatus.PENDING);
            if (pendingInvoices > 0) {
                log.info("Exclusão do cliente {} barrada: {} fatura(s) pendente(s)", id, pendingInvoices);
                return MutationOutcome.rejected(PENDING_INVOICES_MESSAGE);
            }

            int deleted = customerRepository.deleteUnlessInvoicesInStatus(id, InvoiceStatus.PENDING);
            if (deleted == 0 && invoiceRepository.countByCustomerIdAndStatus(id, InvoiceStatus.PENDING) > 0) {
                log.info("Exclusão do cliente {} barrada: fatura pendente criada durante a exclusão", id);
                return MutationOutcome.rejected(PENDING_INVOICES_MESSAGE);
            }
        } catch (DataAccessException | TransactionException e) {
            log.error("Erro ao excluir cliente {}", id, e);
            return MutationOutcome.failure("Database Error: Failed to delete customer.");
        }

        viewCacheInvalidator.revalidatePath(views.customersPath());
        return MutationOutcome.success("Customer deleted successfully.");
    }
}
