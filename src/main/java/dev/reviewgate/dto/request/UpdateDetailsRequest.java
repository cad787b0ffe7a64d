package dev.reviewgate.dto.request;

public record UpdateDetailsRequest(String title, String description) {
}
