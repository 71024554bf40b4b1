package com.invoicedesk.backend.repositories;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import com.invoicedesk.backend.entities.Invoice;
import com.invoicedesk.backend.enums.InvoiceStatus;

public interface InvoiceRepository extends JpaRepository<Invoice, String> {

    List<Invoice> findAllByOrderByDateDesc();

    long countByCustomerIdAndStatus(String customerId, InvoiceStatus status);

    /**
     * Sobrescreve cliente, valor e status; a data de emissão nunca muda depois da criação.
     *
     * @return linhas afetadas (0 quando o id não existe)
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
            update Invoice i
            set i.customerId = :customerId, i.amount = :amount, i.status = :status
            where i.id = :id
            """)
    int updateInvoice(
            @Param("id") String id,
            @Param("customerId") String customerId,
            @Param("amount") long amount,
            @Param("status") InvoiceStatus status
    );

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("delete from Invoice i where i.id = :id")
    int deleteInvoiceById(@Param("id") String id);
}
