package com.splitttr.realtime.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DocumentResponse(
    String id,
    String title,
    String content,
    long version,
    Instant updatedAt
) {}
