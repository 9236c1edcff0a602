package dev.marketbloom.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Result of a contact form submission")
public class ContactResponse {

    public static final String SUCCESS_MESSAGE = "Form submitted successfully! We will contact you soon.";

    @Builder.Default
    private boolean success = true;

    @Builder.Default
    private String message = SUCCESS_MESSAGE;

    @Schema(description = "Id assigned by the store", example = "42")
    private Long submissionId;

    public static ContactResponse of(Long submissionId) {
        return ContactResponse.builder().submissionId(submissionId).build();
    }
}
