package com.swisspairing.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public final class PlayerRequests {

    private PlayerRequests() {
    }

    public record RegisterPlayerRequest(
            @NotBlank(message = "name is required")
            @Size(max = 255, message = "name must be at most 255 characters")
            String name
    ) {
    }
}
