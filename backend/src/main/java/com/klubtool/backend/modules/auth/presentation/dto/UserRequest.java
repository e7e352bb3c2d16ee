package com.klubtool.backend.modules.auth.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record UserRequest(
        @NotBlank(message = "LOGIN_ID_REQUIRED")
        @Size(max = 50, message = "LOGIN_ID_TOO_LONG")
        String loginId,
        @NotBlank(message = "PASSWORD_REQUIRED")
        @Size(min = 8, max = 128, message = "PASSWORD_LENGTH_INVALID")
        String password,
        @NotBlank(message = "FULL_NAME_REQUIRED")
        @Size(max = 100, message = "FULL_NAME_TOO_LONG")
        String fullName,
        @NotBlank(message = "EMAIL_REQUIRED")
        @Email(message = "EMAIL_INVALID")
        String email,
        UUID roleId,
        @Pattern(regexp = "en|de", message = "LANGUAGE_UNSUPPORTED")
        String language,
        Boolean superuser
) {
}
