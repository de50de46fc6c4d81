package com.minilex.playground.dto;

import jakarta.validation.constraints.NotNull;

/**
 * Length is checked by the service against {@code minilex.scanner.max-source-length}.
 */
public record ScanRequest(
        @NotNull(message = "Source code cannot be null")
        String sourceCode) {
}
