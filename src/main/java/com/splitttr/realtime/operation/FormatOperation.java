package com.splitttr.realtime.operation;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FormatOperation(
    String id,
    String sessionId,
    String userId,
    long timestamp,
    Long baseRevision,
    Long revision,
    int start,
    int end,
    TextFormat format,
    @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean absorbed
) implements EditOperation {

    public static FormatOperation of(String userId, long timestamp, int start, int end, TextFormat format) {
        return new FormatOperation(null, null, userId, timestamp, null, null, start, end, format, false);
    }

    @Override
    public OperationType kind() {
        return OperationType.FORMAT;
    }

    @Override
    public boolean isWellFormed() {
        return start >= 0 && start < end && format != null;
    }

    public FormatOperation withRange(int newStart, int newEnd) {
        return new FormatOperation(id, sessionId, userId, timestamp, baseRevision, revision, newStart, newEnd, format,
            absorbed || newStart >= newEnd);
    }

    public FormatOperation basedOn(Long base) {
        return new FormatOperation(id, sessionId, userId, timestamp, base, revision, start, end, format, absorbed);
    }

    public FormattingRange toRange() {
        return new FormattingRange(start, end, format);
    }

    @Override
    public FormatOperation withOrigin(String newId, String newSessionId, String newUserId, long newTimestamp) {
        return new FormatOperation(newId, newSessionId, newUserId, newTimestamp, baseRevision, revision, start, end, format, false);
    }

    @Override
    public FormatOperation withRevision(long newRevision) {
        return new FormatOperation(id, sessionId, userId, timestamp, baseRevision, newRevision, start, end, format, absorbed);
    }
}
