package com.callshield.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
