package com.norma.api;

import jakarta.validation.constraints.NotBlank;

public record QueryRequest(
        @NotBlank String query
) {
}
