package dev.reviewgate.dto.request;

public record AuthorResponseRequest(String text) {
}
