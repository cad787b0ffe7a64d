package dev.reviewgate.dto.response;

import java.util.UUID;

public record CountResponse(UUID id, int count) {
}
