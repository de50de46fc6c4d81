package com.minilex.playground.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScanResponse(
        boolean success,
        List<ScannedToken> tokens,
        int invalidCount,
        String error,
        long analysisTimeMs) {

    public static ScanResponse success(List<ScannedToken> tokens, int invalidCount, long analysisTimeMs) {
        return new ScanResponse(true, tokens, invalidCount, null, analysisTimeMs);
    }

    public static ScanResponse error(String error, long analysisTimeMs) {
        return new ScanResponse(false, List.of(), 0, error, analysisTimeMs);
    }
}
