package com.minilex.playground.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Positive;

@ConfigurationProperties(prefix = "minilex.scanner")
@Validated
public record ScannerProperties(
    @Positive
    @DefaultValue("10000")
    int maxSourceLength,

    @Positive
    @DefaultValue("100000")
    int maxTokens,

    @DefaultValue("false")
    boolean rejectInvalid,

    @DefaultValue("false")
    boolean sampleOnStartup
) {
}
