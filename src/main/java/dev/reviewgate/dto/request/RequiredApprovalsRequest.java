package dev.reviewgate.dto.request;

public record RequiredApprovalsRequest(int count) {
}
