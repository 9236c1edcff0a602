package dev.marketbloom.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Standard response DTO for simple messages.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Standard message response")
public class MessageResponse {

    @Schema(description = "Whether the operation was successful", example = "true")
    @Builder.Default
    private boolean success = true;

    @Schema(description = "Response message", example = "Submission deleted successfully")
    private String message;

    /**
     * Create a simple success message response.
     */
    public static MessageResponse of(String message) {
        return MessageResponse.builder()
                .success(true)
                .message(message)
                .build();
    }
}
