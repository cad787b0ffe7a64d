package dev.reviewgate.dto.request;

import java.util.List;

public record AddFilesRequest(List<FileChangeRequest> files) {
}
