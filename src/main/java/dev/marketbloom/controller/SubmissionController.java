package dev.marketbloom.controller;

import dev.marketbloom.config.OpenApiConfig;
import dev.marketbloom.dto.MessageResponse;
import dev.marketbloom.dto.SubmissionListResponse;
import dev.marketbloom.service.SubmissionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/submissions")
@Tag(name = "Admin - Submissions", description = "Stored lead management")
@SecurityRequirement(name = OpenApiConfig.ADMIN_BEARER_SCHEME)
@RequiredArgsConstructor
@Slf4j
public class SubmissionController {

    static final String DELETED_MESSAGE = "Submission deleted successfully";

    private final SubmissionService submissionService;

    @GetMapping
    @Operation(summary = "List submissions", description = "All stored submissions, newest first")
    public Mono<SubmissionListResponse> listSubmissions() {
        return submissionService.listSubmissions()
                .map(SubmissionListResponse::of);
    }

    // id stays a String: a non-numeric id is a 404, not a 400
    @DeleteMapping("/{id}")
    @Operation(summary = "Delete submission", description = "Permanently removes a submission")
    public Mono<MessageResponse> deleteSubmission(@PathVariable String id) {
        log.debug("Delete requested for submission {}", id);
        return submissionService.deleteSubmission(id)
                .then(Mono.fromSupplier(() -> MessageResponse.of(DELETED_MESSAGE)));
    }
}
