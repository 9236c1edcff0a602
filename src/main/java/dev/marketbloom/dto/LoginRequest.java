package dev.marketbloom.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @NotEmpty(message = "Password required")
    private String password;

    @Override
    public String toString() {
        return "LoginRequest[password=****]";
    }
}
