package com.invoicedesk.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;

@Data
public class CustomerResponseDTO {

    private String id;
    private String name;
    private String email;

    @JsonProperty("image_url")
    private String imageUrl;
}
