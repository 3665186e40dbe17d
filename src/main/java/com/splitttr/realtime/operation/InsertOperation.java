package com.splitttr.realtime.operation;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record InsertOperation(
    String id,
    String sessionId,
    String userId,
    long timestamp,
    Long baseRevision,
    Long revision,
    int position,
    String text,
    TextFormat format,
    @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean absorbed
) implements EditOperation {

    public static InsertOperation of(String userId, long timestamp, int position, String text) {
        return new InsertOperation(null, null, userId, timestamp, null, null, position, text, null, false);
    }

    @Override
    public OperationType kind() {
        return OperationType.INSERT;
    }

    @Override
    public boolean isWellFormed() {
        return position >= 0 && text != null && !text.isEmpty();
    }

    public int length() {
        return text == null ? 0 : text.length();
    }

    public InsertOperation atPosition(int newPosition) {
        return new InsertOperation(id, sessionId, userId, timestamp, baseRevision, revision, newPosition, text, format, absorbed);
    }

    public InsertOperation basedOn(Long base) {
        return new InsertOperation(id, sessionId, userId, timestamp, base, revision, position, text, format, absorbed);
    }

    /**
     * Copy whose text was removed by a concurrent delete; it no longer changes the document.
     */
    public InsertOperation absorbedAt(int newPosition) {
        return new InsertOperation(id, sessionId, userId, timestamp, baseRevision, revision, newPosition, text, format, true);
    }

    @Override
    public InsertOperation withOrigin(String newId, String newSessionId, String newUserId, long newTimestamp) {
        return new InsertOperation(newId, newSessionId, newUserId, newTimestamp, baseRevision, revision, position, text, format, false);
    }

    @Override
    public InsertOperation withRevision(long newRevision) {
        return new InsertOperation(id, sessionId, userId, timestamp, baseRevision, newRevision, position, text, format, absorbed);
    }
}
