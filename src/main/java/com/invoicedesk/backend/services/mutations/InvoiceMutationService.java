package com.invoicedesk.backend.services.mutations;

import java.time.Clock;
import java.time.LocalDate;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import com.invoicedesk.backend.config.ViewsProperties;
import com.invoicedesk.backend.dto.FormState;
import com.invoicedesk.backend.entities.Invoice;
import com.invoicedesk.backend.repositories.InvoiceRepository;
import com.invoicedesk.backend.services.ViewCacheInvalidator;
import com.invoicedesk.backend.validation.FormInput;
import com.invoicedesk.backend.validation.FormSchemas;
import com.invoicedesk.backend.validation.InvoiceDraft;
import com.invoicedesk.backend.validation.ValidationResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Criação, atualização e exclusão de faturas a partir de envios de formulário.
 *
 * <p>Cada chamada é independente: valida, grava, invalida a listagem de faturas e
 * devolve um {@link MutationOutcome}. Falhas de banco são capturadas aqui e viram
 * mensagem; nada é repetido.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InvoiceMutationService {

    private final FormSchemas schemas;
    private final InvoiceRepository invoiceRepository;
    private final ViewCacheInvalidator viewCacheInvalidator;
    private final ViewsProperties views;
    private final Clock clock;

    /**
     * @param prevState estado anterior do formulário; não é consultado
     */
    public MutationOutcome createInvoice(FormState prevState, FormInput form) {
        ValidationResult<InvoiceDraft> validated = schemas.createInvoice().safeParse(form);
        if (!validated.isValid()) {
            return MutationOutcome.failure(
                    FormState.invalid(validated.getFieldErrors(), "Missing Fields. Failed to Create Invoice."));
        }

        InvoiceDraft draft = validated.getValue();

        Invoice invoice = new Invoice();
        invoice.setCustomerId(draft.customerId());
        invoice.setAmount(draft.amountInMinorUnits());
        invoice.setStatus(draft.status());
        invoice.setDate(LocalDate.now(clock));

        try {
            invoiceRepository.save(invoice);
        } catch (DataAccessException | TransactionException e) {
            log.error("Erro ao criar fatura para o cliente {}", draft.customerId(), e);
            return MutationOutcome.failure(StorageErrors.describe("Create Invoice", e));
        }

        viewCacheInvalidator.revalidatePath(views.invoicesPath());
        return MutationOutcome.redirect(views.invoicesPath());
    }

    /**
     * Sobrescreve cliente, valor e status. Um id inexistente não altera nada e também redireciona.
     *
     * @param prevState estado anterior do formulário; não é consultado
     */
    public MutationOutcome updateInvoice(String id, FormState prevState, FormInput form) {
        ValidationResult<InvoiceDraft> validated = schemas.updateInvoice().safeParse(form);
        if (!validated.isValid()) {
            return MutationOutcome.failure(
                    FormState.invalid(validated.getFieldErrors(), "Missing Fields. Failed to Update Invoice."));
        }

        InvoiceDraft draft = validated.getValue();

        try {
            int updated = invoiceRepository.updateInvoice(
                    id, draft.customerId(), draft.amountInMinorUnits(), draft.status());
            if (updated == 0) {
                log.debug("Atualização da fatura {} não encontrou linhas", id);
            }
        } catch (DataAccessException | TransactionException e) {
            log.error("Erro ao atualizar fatura {}", id, e);
            return MutationOutcome.failure(StorageErrors.describe("Update Invoice", e));
        }

        viewCacheInvalidator.revalidatePath(views.invoicesPath());
        return MutationOutcome.redirect(views.invoicesPath());
    }

    // chamada direto da listagem, sem envio de página: não redireciona
    public MutationOutcome deleteInvoice(String id) {
        try {
            invoiceRepository.deleteInvoiceById(id);
        } catch (DataAccessException | TransactionException e) {
            log.error("Erro ao excluir fatura {}", id, e);
            return MutationOutcome.failure(StorageErrors.describe("Delete Invoice", e));
        }

        viewCacheInvalidator.revalidatePath(views.invoicesPath());
        return MutationOutcome.success("Deleted Invoice.");
    }
}
