package com.example.identity_gateway.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProfileServiceUserDetails(
    Long custId,
    String userLogin,
    @JsonProperty("emailAddress") String email,
    String firstName,
    String lastName,
    String encryptedPid) {}
