package com.klubtool.backend.modules.auth.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record UpdateUserRequest(
        @Size(min = 8, max = 128, message = "PASSWORD_LENGTH_INVALID")
        String password,
        @Size(min = 1, max = 100, message = "FULL_NAME_INVALID")
        String fullName,
        @Email(message = "EMAIL_INVALID")
        String email,
        UUID roleId,
        Boolean clearRole,
        @Pattern(regexp = "en|de", message = "LANGUAGE_UNSUPPORTED")
        String language,
        Boolean superuser,
        Boolean active
) {
}
