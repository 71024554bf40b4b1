package com.invoicedesk.backend.services.mutations;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.CannotCreateTransactionException;

import com.invoicedesk.backend.config.ViewsProperties;
import com.invoicedesk.backend.dto.FormState;
import com.invoicedesk.backend.entities.Invoice;
import com.invoicedesk.backend.enums.InvoiceStatus;
import com.invoicedesk.backend.repositories.InvoiceRepository;
import com.invoicedesk.backend.services.ViewCacheInvalidator;
import com.invoicedesk.backend.validation.FormInput;
import com.invoicedesk.backend.validation.FormSchemas;
import com.invoicedesk.backend.validation.InvoiceForm;

import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;

@ExtendWith(MockitoExtension.class)
class InvoiceMutationServiceTest {

    private static ValidatorFactory factory;

    @Mock
    private InvoiceRepository invoiceRepository;

    @Mock
    private ViewCacheInvalidator viewCacheInvalidator;

    private InvoiceMutationService service;

    @BeforeAll
    static void buildValidator() {
        factory = Validation.buildDefaultValidatorFactory();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-15T23:30:00Z"), ZoneOffset.UTC);
        service = new InvoiceMutationService(
                new FormSchemas(factory.getValidator()),
                invoiceRepository,
                viewCacheInvalidator,
                ViewsProperties.defaults(),
                clock
        );
    }

    private static FormInput form(String customerId, String amount, String status) {
        return FormInput.of(Map.of("customerId", customerId, "amount", amount, "status", status));
    }

    @Test
    void createInvoice_validForm_storesCentsAndToday_thenRedirects() {
        when(invoiceRepository.save(any(Invoice.class))).thenAnswer(inv -> inv.getArgument(0));

        MutationOutcome outcome = service.createInvoice(FormState.empty(), form("c1", "50", "pending"));

        ArgumentCaptor<Invoice> captor = ArgumentCaptor.forClass(Invoice.class);
        verify(invoiceRepository).save(captor.capture());
        Invoice saved = captor.getValue();
        assertEquals("c1", saved.getCustomerId());
        assertEquals(5000L, saved.getAmount());
        assertEquals(InvoiceStatus.PENDING, saved.getStatus());
        assertEquals(LocalDate.of(2024, 3, 15), saved.getDate());

        assertTrue(outcome.isRedirect());
        assertEquals("/dashboard/invoices", outcome.getTarget());
        verify(viewCacheInvalidator).revalidatePath("/dashboard/invoices");
    }

    @Test
    void createInvoice_invalidAmount_returnsFieldErrors_andWritesNothing() {
        MutationOutcome outcome = service.createInvoice(FormState.empty(), form("c1", "0", "paid"));

        assertEquals(MutationOutcome.Kind.FAILURE, outcome.getKind());
        assertEquals("Missing Fields. Failed to Create Invoice.", outcome.getMessage());
        assertEquals(Map.of("amount", List.of(InvoiceForm.AMOUNT_MESSAGE)), outcome.getState().getErrors());

        verifyNoInteractions(invoiceRepository);
        verifyNoInteractions(viewCacheInvalidator);
    }

    @Test
    void createInvoice_storageFailure_returnsDatabaseErrorMessage_withoutInvalidating() {
        when(invoiceRepository.save(any(Invoice.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        MutationOutcome outcome = service.createInvoice(FormState.empty(), form("c1", "50", "pending"));

        assertEquals(MutationOutcome.Kind.FAILURE, outcome.getKind());
        assertTrue(outcome.getMessage().startsWith("Database Error: Failed to Create Invoice."));
        assertTrue(outcome.getMessage().contains("connection refused"));
        assertNull(outcome.getState().getErrors());
        verifyNoInteractions(viewCacheInvalidator);
    }

    @Test
    void createInvoice_negativeAmount_writesNothing() {
        MutationOutcome outcome = service.createInvoice(FormState.empty(), form("c1", "-5", "pending"));

        assertEquals(Map.of("amount", List.of(InvoiceForm.AMOUNT_MESSAGE)), outcome.getState().getErrors());
        verifyNoInteractions(invoiceRepository);
    }

    @Test
    void createInvoice_subCentAmount_writesNothing() {
        MutationOutcome outcome = service.createInvoice(FormState.empty(), form("c1", "0.001", "pending"));

        assertEquals(MutationOutcome.Kind.FAILURE, outcome.getKind());
        assertEquals(Map.of("amount", List.of(InvoiceForm.AMOUNT_MESSAGE)), outcome.getState().getErrors());
        verifyNoInteractions(invoiceRepository);
    }

    @Test
    void createInvoice_noConnectionAvailable_returnsDatabaseErrorMessage() {
        when(invoiceRepository.save(any(Invoice.class)))
                .thenThrow(new CannotCreateTransactionException("Could not open JPA EntityManager for transaction"));

        MutationOutcome outcome = service.createInvoice(FormState.empty(), form("c1", "50", "pending"));

        assertEquals(MutationOutcome.Kind.FAILURE, outcome.getKind());
        assertEquals("Database Error: Failed to Create Invoice. Could not open JPA EntityManager for transaction",
                outcome.getMessage());
        verifyNoInteractions(viewCacheInvalidator);
    }

    @Test
    void updateInvoice_validForm_overwritesFieldsButNotDate() {
        when(invoiceRepository.updateInvoice("inv-1", "c2", 1234L, InvoiceStatus.PAID)).thenReturn(1);

        MutationOutcome outcome = service.updateInvoice("inv-1", FormState.empty(), form("c2", "12.34", "paid"));

        verify(invoiceRepository).updateInvoice("inv-1", "c2", 1234L, InvoiceStatus.PAID);
        assertTrue(outcome.isRedirect());
        verify(viewCacheInvalidator).revalidatePath("/dashboard/invoices");
    }

    @Test
    void updateInvoice_unknownId_stillRedirects() {
        when(invoiceRepository.updateInvoice(anyString(), anyString(), anyLong(), any())).thenReturn(0);

        MutationOutcome outcome = service.updateInvoice("missing", FormState.empty(), form("c2", "1", "paid"));

        assertTrue(outcome.isRedirect());
    }

    @Test
    void updateInvoice_invalidStatus_usesUpdateMessage() {
        MutationOutcome outcome = service.updateInvoice("inv-1", FormState.empty(), form("c2", "1", "void"));

        assertEquals("Missing Fields. Failed to Update Invoice.", outcome.getMessage());
        assertEquals(List.of(InvoiceForm.STATUS_MESSAGE), outcome.getState().getErrors().get("status"));
        verify(invoiceRepository, never()).updateInvoice(anyString(), anyString(), anyLong(), any());
    }

    @Test
    void updateInvoice_storageFailure_returnsDatabaseErrorMessage() {
        when(invoiceRepository.updateInvoice(anyString(), anyString(), anyLong(), any()))
                .thenThrow(new DataAccessResourceFailureException("timeout"));

        MutationOutcome outcome = service.updateInvoice("inv-1", FormState.empty(), form("c2", "1", "paid"));

        assertEquals(MutationOutcome.Kind.FAILURE, outcome.getKind());
        assertEquals("Database Error: Failed to Update Invoice. timeout", outcome.getMessage());
    }

    @Test
    void deleteInvoice_returnsConfirmation_andInvalidates() {
        when(invoiceRepository.deleteInvoiceById("inv-1")).thenReturn(1);

        MutationOutcome outcome = service.deleteInvoice("inv-1");

        assertEquals(MutationOutcome.Kind.SUCCESS, outcome.getKind());
        assertEquals("Deleted Invoice.", outcome.getMessage());
        verify(viewCacheInvalidator).revalidatePath("/dashboard/invoices");
    }

    @Test
    void deleteInvoice_storageFailure_returnsDatabaseErrorMessage() {
        when(invoiceRepository.deleteInvoiceById("inv-1"))
                .thenThrow(new DataAccessResourceFailureException("down"));

        MutationOutcome outcome = service.deleteInvoice("inv-1");

        assertEquals("Database Error: Failed to Delete Invoice. down", outcome.getMessage());
        verifyNoInteractions(viewCacheInvalidator);
    }

    @Test
    void updateInvoice_noConnectionAvailable_returnsDatabaseErrorMessage() {
        when(invoiceRepository.updateInvoice(anyString(), anyString(), anyLong(), any()))
                .thenThrow(new CannotCreateTransactionException("pool closed"));

        MutationOutcome outcome = service.updateInvoice("inv-1", FormState.empty(), form("c2", "1", "paid"));

        assertEquals("Database Error: Failed to Update Invoice. pool closed", outcome.getMessage());
    }

    @Test
    void deleteInvoice_noConnectionAvailable_returnsDatabaseErrorMessage() {
        when(invoiceRepository.deleteInvoiceById("x"))
                .thenThrow(new CannotCreateTransactionException("pool closed"));

        MutationOutcome outcome = service.deleteInvoice("x");

        assertEquals(MutationOutcome.Kind.FAILURE, outcome.getKind());
        assertEquals("Database Error: Failed to Delete Invoice. pool closed", outcome.getMessage());
        verifyNoInteractions(viewCacheInvalidator);
    }
}
