package com.storefront.authservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @NotBlank(message = "email is required")
    @Size(max = 100, message = "email must be <= 100 characters")
    @Email(message = "email is invalid")
    private String email;

    @NotBlank(message = "password is required")
    @Size(max = 256, message = "password must be <= 256 characters")
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String password;

    @Override
    public String toString() {
        return "LoginRequest(email=" + email + ")";
    }
}
