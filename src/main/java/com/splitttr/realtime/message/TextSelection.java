package com.splitttr.realtime.message;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TextSelection(
    String userId,
    int start,
    int end,
    Instant timestamp
) {
    public TextSelection stamped(String owner, Instant at) {
        return new TextSelection(owner, start, end, at);
    }
}
