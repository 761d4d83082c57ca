package com.expektra.opendata.infrastructure.web.dto;

public record ErrorResponse(String error, String message) {
}
