package com.invoicedesk.backend.services;

import java.util.List;

import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import com.invoicedesk.backend.config.CacheConfig;
import com.invoicedesk.backend.dto.InvoiceResponseDTO;
import com.invoicedesk.backend.exceptions.ResourceNotFoundException;
import com.invoicedesk.backend.mappers.InvoiceMapper;
import com.invoicedesk.backend.repositories.InvoiceRepository;

import lombok.RequiredArgsConstructor;

/**
 * Leituras das faturas. As views ficam em cache até a próxima escrita invalidar
 * {@link CacheConfig#INVOICES_CACHE}.
 */
@Service
@RequiredArgsConstructor
public class InvoiceService {

    private final InvoiceRepository invoiceRepository;

    @Cacheable(cacheNames = CacheConfig.INVOICES_CACHE, key = "'all'")
    public List<InvoiceResponseDTO> findAll() {
        return invoiceRepository.findAllByOrderByDateDesc().stream()
                .map(InvoiceMapper::toResponseDTO)
                .toList();
    }

    @Cacheable(cacheNames = CacheConfig.INVOICES_CACHE, key = "#id")
    public InvoiceResponseDTO findById(String id) {
        return invoiceRepository.findById(id)
                .map(InvoiceMapper::toResponseDTO)
                .orElseThrow(() -> new ResourceNotFoundException("Invoice not found"));
    }
}
