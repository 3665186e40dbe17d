package com.splitttr.realtime.operation;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeleteOperation(
    String id,
    String sessionId,
    String userId,
    long timestamp,
    Long baseRevision,
    Long revision,
    int position,
    int length,
    @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean absorbed
) implements EditOperation {

    public static DeleteOperation of(String userId, long timestamp, int position, int length) {
        return new DeleteOperation(null, null, userId, timestamp, null, null, position, length, false);
    }

    @Override
    public OperationType kind() {
        return OperationType.DELETE;
    }

    /**
     * A delete must remove at least one character and its end must be representable.
     */
    @Override
    public boolean isWellFormed() {
        return position >= 0 && length > 0 && length <= Integer.MAX_VALUE - position;
    }

    public int end() {
        return position + length;
    }

    public DeleteOperation withRange(int newPosition, int newLength) {
        return new DeleteOperation(id, sessionId, userId, timestamp, baseRevision, revision, newPosition, newLength,
            absorbed || newLength == 0);
    }

    public DeleteOperation basedOn(Long base) {
        return new DeleteOperation(id, sessionId, userId, timestamp, base, revision, position, length, absorbed);
    }

    @Override
    public DeleteOperation withOrigin(String newId, String newSessionId, String newUserId, long newTimestamp) {
        return new DeleteOperation(newId, newSessionId, newUserId, newTimestamp, baseRevision, revision, position, length, false);
    }

    @Override
    public DeleteOperation withRevision(long newRevision) {
        return new DeleteOperation(id, sessionId, userId, timestamp, baseRevision, newRevision, position, length, absorbed);
    }
}
