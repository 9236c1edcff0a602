package dev.marketbloom.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Contact form submission")
public class ContactRequest {

    public static final String REQUIRED_FIELDS_MESSAGE = "Please fill in all required fields";

    @NotEmpty(message = REQUIRED_FIELDS_MESSAGE)
    @Schema(example = "Asha Rao")
    private String name;

    @NotEmpty(message = REQUIRED_FIELDS_MESSAGE)
    @Schema(example = "Rao Bakery")
    private String business;

    @NotEmpty(message = REQUIRED_FIELDS_MESSAGE)
    @Schema(example = "Social media marketing")
    private String service;

    @NotEmpty(message = REQUIRED_FIELDS_MESSAGE)
    @Schema(example = "+91 98765 43210")
    private String phone;

    @Schema(description = "Optional free text", example = "Looking to launch in March")
    private String message;
}
