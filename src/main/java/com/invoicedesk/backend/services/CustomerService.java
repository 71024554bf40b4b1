package com.invoicedesk.backend.services;

import java.util.List;

import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import com.invoicedesk.backend.config.CacheConfig;
import com.invoicedesk.backend.dto.CustomerResponseDTO;
import com.invoicedesk.backend.exceptions.ResourceNotFoundException;
import com.invoicedesk.backend.mappers.CustomerMapper;
import com.invoicedesk.backend.repositories.CustomerRepository;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class CustomerService {

    private final CustomerRepository customerRepository;

    @Cacheable(cacheNames = CacheConfig.CUSTOMERS_CACHE, key = "'all'")
    public List<CustomerResponseDTO> findAll() {
        return customerRepository.findAllByOrderByNameAsc().stream()
                .map(CustomerMapper::toResponseDTO)
                .toList();
    }

    @Cacheable(cacheNames = CacheConfig.CUSTOMERS_CACHE, key = "#id")
    public CustomerResponseDTO findById(String id) {
        return customerRepository.findById(id)
                .map(CustomerMapper::toResponseDTO)
                .orElseThrow(() -> new ResourceNotFoundException("Customer not found"));
    }
}
