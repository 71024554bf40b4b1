package com.invoicedesk.backend.repositories;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import com.invoicedesk.backend.entities.Customer;
import com.invoicedesk.backend.enums.InvoiceStatus;

public interface CustomerRepository extends JpaRepository<Customer, String> {

    List<Customer> findAllByOrderByNameAsc();

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
            update Customer c
            set c.name = :name, c.email = :email, c.imageUrl = :imageUrl
            where c.id = :id
            """)
    int updateCustomer(
            @Param("id") String id,
            @Param("name") String name,
            @Param("email") String email,
            @Param("imageUrl") String imageUrl
    );

    /**
     * Remove o cliente somente se ele não tiver faturas no status informado.
     * A regra é reavaliada dentro do próprio DELETE, então uma fatura criada depois da
     * contagem prévia faz o comando não remover nada.
     *
     * @return linhas removidas
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
            delete from Customer c
            where c.id = :id
            and not exists (
                select i.id from Invoice i
                where i.customerId = :id and i.status = :status
            )
            """)
    int deleteUnlessInvoicesInStatus(@Param("id") String id, @Param("status") InvoiceStatus status);
}
