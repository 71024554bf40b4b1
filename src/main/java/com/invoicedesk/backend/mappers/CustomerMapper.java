package com.invoicedesk.backend.mappers;

import com.invoicedesk.backend.dto.CustomerResponseDTO;
import com.invoicedesk.backend.entities.Customer;

public class CustomerMapper {

    private CustomerMapper() {
    }

    public static CustomerResponseDTO toResponseDTO(Customer customer) {
        CustomerResponseDTO dto = new CustomerResponseDTO();
        dto.setId(customer.getId());
        dto.setName(customer.getName());
        dto.setEmail(customer.getEmail());
        dto.setImageUrl(customer.getImageUrl());
        return dto;
    }
}
