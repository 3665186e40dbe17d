package com.splitttr.realtime.operation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * An edit against a session's text. Operations are immutable; transformation and admission
 * produce adjusted copies.
 *
 * <p>{@code baseRevision} is the last session revision the author had applied when the edit was
 * made. {@code revision} is assigned by the session when the edit is admitted to the log.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = InsertOperation.class, name = "insert"),
    @JsonSubTypes.Type(value = DeleteOperation.class, name = "delete"),
    @JsonSubTypes.Type(value = FormatOperation.class, name = "format")
})
public sealed interface EditOperation permits InsertOperation, DeleteOperation, FormatOperation {

    String id();

    String sessionId();

    String userId();

    long timestamp();

    Long baseRevision();

    Long revision();

    @JsonIgnore
    OperationType kind();

    /**
     * Structural checks that do not depend on document state.
     */
    @JsonIgnore
    boolean isWellFormed();

    /**
     * True when concurrent edits already removed everything this edit would change. Such an edit
     * is acknowledged but never applied or logged.
     */
    boolean absorbed();

    /**
     * Copy stamped with the server-side identity of the edit.
     */
    EditOperation withOrigin(String id, String sessionId, String userId, long timestamp);

    EditOperation withRevision(long revision);
}
