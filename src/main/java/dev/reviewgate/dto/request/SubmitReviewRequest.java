package dev.reviewgate.dto.request;

import dev.reviewgate.domain.enums.Verdict;

import java.util.List;

public record SubmitReviewRequest(Verdict verdict, String summary, List<CommentRequest> comments) {
}
