package com.geodash.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public final class UserRequests {

    private UserRequests() {
    }

    public record CreateUserRequest(
            @Size(max = 255, message = "name must be at most 255 characters")
            String name,

            @NotBlank(message = "email is required")
            @Email(message = "email must be a valid address")
            String email,

            @Size(max = 255, message = "avatarUrl must be at most 255 characters")
            String avatarUrl
    ) {
    }
}
