package com.example.creatorclaims.web.dto;

import com.example.creatorclaims.domain.Platform;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record LinkSocialAccountRequest(
        @NotNull(message = "Platform is required")
        Platform platform,

        @NotBlank(message = "Profile URL cannot be blank")
        @Size(max = 512, message = "Profile URL must be at most 512 characters")
        String profileUrl,

        @Size(max = 255, message = "Username must be at most 255 characters")
        String username
) {}
