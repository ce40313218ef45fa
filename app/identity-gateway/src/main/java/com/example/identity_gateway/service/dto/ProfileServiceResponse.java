package com.example.identity_gateway.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProfileServiceResponse(ProfileServiceUserDetails details) {}
