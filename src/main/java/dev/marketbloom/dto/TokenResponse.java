package dev.marketbloom.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenResponse {
    @Builder.Default
    private boolean success = true;
    @Builder.Default
    private String message = "Login successful";
    private String token; // bearer value for the admin endpoints
}
