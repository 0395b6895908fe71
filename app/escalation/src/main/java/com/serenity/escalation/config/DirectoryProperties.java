package com.serenity.escalation.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Recipient directory settings; members are chunked into tiers of {@code tierSize}. */
@ConfigurationProperties(prefix = "crisis.directory")
@Validated
public record DirectoryProperties(@Positive int tierSize) {}
