package dev.marketbloom.controller;

import dev.marketbloom.dto.SubmissionResponse;
import dev.marketbloom.exception.ResourceNotFoundException;
import dev.marketbloom.service.SubmissionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SubmissionControllerTest {

    @Mock
    private SubmissionService submissionService;

    @InjectMocks
    private SubmissionController submissionController;

    @Nested
    @DisplayName("GET /api/submissions")
    class ListSubmissions {

        @Test
        @DisplayName("Should wrap the submissions in the data envelope")
        void shouldWrapSubmissions() {
            SubmissionResponse submission = SubmissionResponse.builder()
                    .id(1L).name("Asha Rao").business("Rao Bakery").service("SEO").phone("1")
                    .message("").status("new").timestamp(LocalDateTime.now())
                    .build();
            when(submissionService.listSubmissions()).thenReturn(Mono.just(List.of(submission)));

            StepVerifier.create(submissionController.listSubmissions())
                    .assertNext(response -> {
                        assertThat(response.isSuccess()).isTrue();
                        assertThat(response.getData()).containsExactly(submission);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should return an empty data list when nothing is stored")
        void shouldReturnEmptyList() {
            when(submissionService.listSubmissions()).thenReturn(Mono.just(List.of()));

            StepVerifier.create(submissionController.listSubmissions())
                    .assertNext(response -> assertThat(response.getData()).isEmpty())
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("DELETE /api/submissions/{id}")
    class DeleteSubmission {

        @Test
        @DisplayName("Should confirm the deletion")
        void shouldConfirmDeletion() {
            when(submissionService.deleteSubmission("4")).thenReturn(Mono.empty());

            StepVerifier.create(submissionController.deleteSubmission("4"))
                    .assertNext(response -> {
                        assertThat(response.isSuccess()).isTrue();
                        assertThat(response.getMessage()).isEqualTo("Submission deleted successfully");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should propagate not found")
        void shouldPropagateNotFound() {
            when(submissionService.deleteSubmission("4"))
                    .thenReturn(Mono.error(new ResourceNotFoundException("Submission not found")));

            StepVerifier.create(submissionController.deleteSubmission("4"))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }
    }
}
