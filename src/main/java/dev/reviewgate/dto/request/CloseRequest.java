package dev.reviewgate.dto.request;

public record CloseRequest(String reason) {
}
