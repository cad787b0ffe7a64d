package dev.reviewgate.controller;

import dev.reviewgate.config.SecurityConfig;
import dev.reviewgate.domain.enums.PullRequestState;
import dev.reviewgate.domain.workflow.PullRequestOperation;
import dev.reviewgate.dto.request.CreatePullRequestRequest;
import dev.reviewgate.dto.request.SubmitReviewRequest;
import dev.reviewgate.dto.response.CountResponse;
import dev.reviewgate.dto.response.MergeabilityResponse;
import dev.reviewgate.dto.response.OperationResults;
import dev.reviewgate.exception.AuthorizationDeniedException;
import dev.reviewgate.exception.GlobalExceptionHandler;
import dev.reviewgate.exception.MergeNotEligibleException;
import dev.reviewgate.exception.PullRequestNotFoundException;
import dev.reviewgate.exception.StateGuardViolationException;
import dev.reviewgate.exception.ValidationFailedException;
import dev.reviewgate.service.PullRequestQueryService;
import dev.reviewgate.service.PullRequestService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web slice: routing, identity header, JSON binding and the problem-detail mapping
 * of every workflow failure. Services are mocked.
 */
@WebMvcTest(PullRequestController.class)
@Import({SecurityConfig.class, GlobalExceptionHandler.class})
class PullRequestControllerTest {

    private static final String IDENTITY = "X-Caller-Identity";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PullRequestService commandService;

    @MockitoBean
    private PullRequestQueryService queryService;

    private final UUID id = UUID.randomUUID();

    @Nested
    @DisplayName("POST /pull-requests")
    class Create {

        @Test
        @DisplayName("should create as the calling identity and return 201 with Location")
        void shouldCreate() throws Exception {
            when(commandService.create(eq("alice"), any(CreatePullRequestRequest.class)))
                    .thenReturn(new OperationResults.Created(id, PullRequestState.DRAFT));

            mockMvc.perform(post("/pull-requests")
                            .header(IDENTITY, "alice")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"title":"Add cache","sourceBranch":"feat","targetBranch":"main",
                                     "fileChanges":[{"path":"a.java","changeType":"ADDED","linesAdded":3,"linesDeleted":0}],
                                     "reviewers":["bob"],"maintainer":"mike","requiredApprovals":1}
                                    """))
                    .andExpect(status().isCreated())
                    .andExpect(header().string("Location", "/pull-requests/" + id))
                    .andExpect(jsonPath("$.id").value(id.toString()))
                    .andExpect(jsonPath("$.state").value("DRAFT"));
        }

        @Test
        @DisplayName("should reject a request without a caller identity")
        void shouldRejectAnonymous() throws Exception {
            mockMvc.perform(post("/pull-requests")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{}"))
                    .andExpect(status().isForbidden());

            verifyNoInteractions(commandService);
        }

        @Test
        @DisplayName("should map a validation failure to 400 with the failing rule")
        void shouldMapValidation() throws Exception {
            when(commandService.create(eq("alice"), any(CreatePullRequestRequest.class)))
                    .thenThrow(new ValidationFailedException("branch.distinct", "branches must differ"));

            mockMvc.perform(post("/pull-requests")
                            .header(IDENTITY, "alice")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"title\":\"t\",\"sourceBranch\":\"main\",\"targetBranch\":\"main\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                    .andExpect(jsonPath("$.rule").value("branch.distinct"));
        }

        @Test
        @DisplayName("should answer malformed JSON with 400 rather than 500")
        void shouldRejectMalformedJson() throws Exception {
            mockMvc.perform(post("/pull-requests")
                            .header(IDENTITY, "alice")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{not json"))
                    .andExpect(status().isBadRequest());
        }
    }

    @Nested
    @DisplayName("workflow operations")
    class Operations {

        @Test
        @DisplayName("should submit a review and return 201")
        void shouldSubmitReview() throws Exception {
            UUID reviewId = UUID.randomUUID();
            when(commandService.submitReview(eq(id), eq("bob"), any(SubmitReviewRequest.class)))
                    .thenReturn(new OperationResults.ReviewSubmitted(reviewId, PullRequestState.APPROVED, 1));

            mockMvc.perform(post("/pull-requests/{id}/reviews", id)
                            .header(IDENTITY, "bob")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"verdict\":\"APPROVE\",\"summary\":\"LGTM\"}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.reviewId").value(reviewId.toString()))
                    .andExpect(jsonPath("$.approvalCount").value(1));
        }

        @Test
        @DisplayName("should merge without a body")
        void shouldMergeWithoutBody() throws Exception {
            when(commandService.merge(eq(id), eq("mike"), isNull()))
                    .thenReturn(new OperationResults.Merged(id, "a".repeat(40), PullRequestState.MERGED));

            mockMvc.perform(post("/pull-requests/{id}/merge", id).header(IDENTITY, "mike"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.commitId").value("a".repeat(40)));
        }

        @Test
        @DisplayName("should map an authorization failure to 403")
        void shouldMapAuthorizationDenied() throws Exception {
            when(commandService.merge(eq(id), eq("alice"), isNull()))
                    .thenThrow(new AuthorizationDeniedException("alice", PullRequestOperation.MERGE, "not maintainer"));

            mockMvc.perform(post("/pull-requests/{id}/merge", id).header(IDENTITY, "alice"))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.code").value("AUTHORIZATION_DENIED"));
        }

        @Test
        @DisplayName("should map a state guard violation to 409 with the current state")
        void shouldMapStateGuard() throws Exception {
            when(commandService.markReadyForReview(id, "alice"))
                    .thenThrow(new StateGuardViolationException(PullRequestOperation.MARK_READY_FOR_REVIEW,
                            PullRequestState.OPEN, "not a draft"));

            mockMvc.perform(post("/pull-requests/{id}/ready-for-review", id).header(IDENTITY, "alice"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.code").value("STATE_GUARD_VIOLATION"))
                    .andExpect(jsonPath("$.operation").value("markReadyForReview"))
                    .andExpect(jsonPath("$.currentState").value("open"));
        }

        @Test
        @DisplayName("should map an ineligible merge to 422")
        void shouldMapMergeNotEligible() throws Exception {
            when(commandService.merge(eq(id), eq("mike"), eq("msg")))
                    .thenThrow(new MergeNotEligibleException(id, "1 unresolved change request(s)"));

            mockMvc.perform(post("/pull-requests/{id}/merge", id)
                            .header(IDENTITY, "mike")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"commitMessage\":\"msg\"}"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.code").value("MERGE_NOT_ELIGIBLE"));
        }

        @Test
        @DisplayName("should map a lost optimistic lock to 409")
        void shouldMapConcurrentModification() throws Exception {
            when(commandService.close(eq(id), eq("mike"), isNull()))
                    .thenThrow(new ObjectOptimisticLockingFailureException("PullRequest", id));

            mockMvc.perform(post("/pull-requests/{id}/close", id).header(IDENTITY, "mike"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.code").value("CONCURRENT_MODIFICATION"));
        }

        @Test
        @DisplayName("should reopen and report the new state")
        void shouldReopen() throws Exception {
            when(commandService.reopen(id, "mike"))
                    .thenReturn(new OperationResults.StateChanged(id, PullRequestState.OPEN, Instant.now()));

            mockMvc.perform(post("/pull-requests/{id}/reopen", id).header(IDENTITY, "mike"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.state").value("OPEN"));
            verify(commandService).reopen(id, "mike");
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("should return the approval count")
        void shouldReturnApprovalCount() throws Exception {
            when(queryService.getApprovalCount(id, "carol")).thenReturn(new CountResponse(id, 2));

            mockMvc.perform(get("/pull-requests/{id}/approvals/count", id).header(IDENTITY, "carol"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.count").value(2));
        }

        @Test
        @DisplayName("should explain why a pull request cannot merge")
        void shouldReturnMergeBlocker() throws Exception {
            when(queryService.canMerge(id, "alice")).thenReturn(
                    new MergeabilityResponse(id, false, PullRequestState.IN_REVIEW, "state is in_review, must be approved"));

            mockMvc.perform(get("/pull-requests/{id}/mergeable", id).header(IDENTITY, "alice"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.canMerge").value(false))
                    .andExpect(jsonPath("$.blocker").value("state is in_review, must be approved"));
        }

        @Test
        @DisplayName("should return 404 for an unknown pull request")
        void shouldReturnNotFound() throws Exception {
            when(queryService.getSummary(id, "alice")).thenThrow(new PullRequestNotFoundException(id));

            mockMvc.perform(get("/pull-requests/{id}", id).header(IDENTITY, "alice"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code").value("PULL_REQUEST_NOT_FOUND"));
        }

        @Test
        @DisplayName("should reject a malformed id with 400")
        void shouldRejectMalformedId() throws Exception {
            mockMvc.perform(get("/pull-requests/not-a-uuid").header(IDENTITY, "alice"))
                    .andExpect(status().isBadRequest());
        }
    }
}
