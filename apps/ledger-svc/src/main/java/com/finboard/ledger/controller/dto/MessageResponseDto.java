package com.finboard.ledger.controller.dto;

public record MessageResponseDto(String message) {
}
