package dev.marketbloom.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "All stored submissions, newest first")
public class SubmissionListResponse {

    @Builder.Default
    private boolean success = true;

    private List<SubmissionResponse> data;

    public static SubmissionListResponse of(List<SubmissionResponse> data) {
        return SubmissionListResponse.builder().data(data).build();
    }
}
