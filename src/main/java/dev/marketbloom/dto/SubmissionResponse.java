package dev.marketbloom.dto;

import dev.marketbloom.entity.Submission;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionResponse {

    private Long id;
    private String name;
    private String business;
    private String service;
    private String phone;
    private String message;
    private LocalDateTime timestamp;
    private String status;

    public static SubmissionResponse from(Submission submission) {
        return SubmissionResponse.builder()
                .id(submission.getId())
                .name(submission.getName())
                .business(submission.getBusiness())
                .service(submission.getService())
                .phone(submission.getPhone())
                .message(submission.getMessage())
                .timestamp(submission.getTimestamp())
                .status(submission.getStatus())
                .build();
    }
}
