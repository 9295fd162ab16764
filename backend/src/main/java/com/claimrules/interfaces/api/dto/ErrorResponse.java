package com.claimrules.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
