package com.staybook.reservation.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ResolveConflictRequest(
        @NotBlank(message = "Resolution note cannot be blank")
        @Size(max = 1000, message = "Resolution note must be at most 1000 characters")
        String note
) {
}
