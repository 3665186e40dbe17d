package com.splitttr.realtime.message;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CursorPosition(
    String userId,
    int position,
    Integer line,
    Integer column,
    Instant timestamp
) {
    public CursorPosition stamped(String owner, Instant at) {
        return new CursorPosition(owner, position, line, column, at);
    }
}
