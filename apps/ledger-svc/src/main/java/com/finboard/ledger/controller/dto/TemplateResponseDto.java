package com.finboard.ledger.controller.dto;

public record TemplateResponseDto(String template) {
}
