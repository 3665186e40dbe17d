package com.splitttr.realtime.transform;

import com.splitttr.realtime.operation.DeleteOperation;
import com.splitttr.realtime.operation.DocumentState;
import com.splitttr.realtime.operation.EditOperation;
import com.splitttr.realtime.operation.FormatOperation;
import com.splitttr.realtime.operation.FormattingRange;
import com.splitttr.realtime.operation.InsertOperation;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Operational transformation for concurrent text edits. Stateless and safe to share.
 *
 * <p>An incoming edit is rewritten against every already-admitted edit that the author had not
 * seen, in log order, so that it applies to the current text with the intended effect.
 */
public class ConflictResolver {

    /**
     * Order of concurrent inserts at the same position: earlier timestamp first, then author. It
     * depends only on the edits themselves, never on which was admitted first.
     */
    private static final Comparator<InsertOperation> INSERT_ORDER = Comparator
        .comparingLong(InsertOperation::timestamp)
        .thenComparing(InsertOperation::userId, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
        .thenComparing(InsertOperation::id, Comparator.nullsFirst(Comparator.<String>naturalOrder()));

    /**
     * Transforms {@code operation} against the concurrent edits in {@code existingOperations}.
     * Edits by {@code userId} itself are never treated as concurrent. The result is marked
     * {@link EditOperation#absorbed() absorbed} when concurrent deletes already removed the text it
     * targets.
     */
    public EditOperation transform(EditOperation operation, List<EditOperation> existingOperations, String userId) {
        EditOperation transformed = operation;
        for (EditOperation existing : existingOperations) {
            if (!existing.absorbed() && isConcurrent(existing, operation, userId)) {
                transformed = transformAgainst(transformed, existing);
            }
        }
        return transformed;
    }

    /**
     * With a base revision the session's logical clock decides; without one the admitted edit is
     * concurrent when it carries a later timestamp.
     */
    public boolean isConcurrent(EditOperation existing, EditOperation operation, String userId) {
        if (Objects.equals(existing.userId(), userId)) {
            return false;
        }
        if (operation.baseRevision() != null && existing.revision() != null) {
            return existing.revision() > operation.baseRevision();
        }
        return existing.timestamp() > operation.timestamp();
    }

    private EditOperation transformAgainst(EditOperation operation, EditOperation other) {
        return switch (operation.kind()) {
            case INSERT -> transformInsert((InsertOperation) operation, other);
            case DELETE -> transformDelete((DeleteOperation) operation, other);
            case FORMAT -> transformFormat((FormatOperation) operation, other);
        };
    }

    private InsertOperation transformInsert(InsertOperation insert, EditOperation other) {
        if (other instanceof InsertOperation otherInsert) {
            int position = otherInsert.position();
            if (position < insert.position()
                || (position == insert.position() && INSERT_ORDER.compare(otherInsert, insert) < 0)) {
                return insert.atPosition(insert.position() + otherInsert.length());
            }
        } else if (other instanceof DeleteOperation otherDelete) {
            if (otherDelete.end() < insert.position()) {
                return insert.atPosition(insert.position() - otherDelete.length());
            }
            // touching or inside the removed range
            if (otherDelete.position() <= insert.position()) {
                return insert.absorbedAt(otherDelete.position());
            }
        }
        return insert;
    }

    private DeleteOperation transformDelete(DeleteOperation delete, EditOperation other) {
        if (other instanceof InsertOperation otherInsert) {
            if (otherInsert.position() < delete.position()) {
                return delete.withRange(delete.position() + otherInsert.length(), delete.length());
            }
            if (!delete.absorbed() && otherInsert.position() <= delete.end()) {
                return delete.withRange(delete.position(), delete.length() + otherInsert.length());
            }
        } else if (other instanceof DeleteOperation otherDelete) {
            int removedBefore = Math.max(0, Math.min(delete.position(), otherDelete.end()) - otherDelete.position());
            int overlap = Math.max(0,
                Math.min(delete.end(), otherDelete.end()) - Math.max(delete.position(), otherDelete.position()));
            if (removedBefore > 0 || overlap > 0) {
                return delete.withRange(delete.position() - removedBefore, delete.length() - overlap);
            }
        }
        return delete;
    }

    private FormatOperation transformFormat(FormatOperation format, EditOperation other) {
        Span span = new Span(format.start(), format.end());
        Span moved = span.after(other);
        return moved.equals(span) ? format : format.withRange(moved.start(), moved.end());
    }

    /**
     * Moves a stored formatting range so it keeps covering the same characters after
     * {@code applied} has changed the text. The result may be empty when its text was deleted.
     */
    public FormattingRange rebase(FormattingRange range, EditOperation applied) {
        Span moved = new Span(range.start(), range.end()).after(applied);
        return new FormattingRange(moved.start(), moved.end(), range.format());
    }

    /**
     * Merges two consecutive edits by the same author into one, or returns {@code null} when they
     * cannot be merged.
     */
    public EditOperation compose(EditOperation first, EditOperation second) {
        if (first == null || second == null || !Objects.equals(first.userId(), second.userId())) {
            return null;
        }

        if (first instanceof InsertOperation a && second instanceof InsertOperation b) {
            if (b.position() == a.position() + a.length() && Objects.equals(a.format(), b.format())) {
                return new InsertOperation(a.id(), a.sessionId(), a.userId(), b.timestamp(),
                    a.baseRevision(), b.revision(), a.position(), a.text() + b.text(), a.format(), false);
            }
        }

        if (first instanceof DeleteOperation a && second instanceof DeleteOperation b) {
            if (b.position() == a.position()) {
                return new DeleteOperation(a.id(), a.sessionId(), a.userId(), b.timestamp(),
                    a.baseRevision(), b.revision(), a.position(), a.length() + b.length(), false);
            }
        }

        return null;
    }

    /**
     * Bounds check against the current text. An absorbed edit only needs a position inside the
     * text, since it changes nothing.
     */
    public boolean validateOperation(EditOperation operation, DocumentState state) {
        if (operation == null) {
            return false;
        }
        int length = state == null ? 0 : state.length();
        if (operation.absorbed()) {
            int position = switch (operation.kind()) {
                case INSERT -> ((InsertOperation) operation).position();
                case DELETE -> ((DeleteOperation) operation).position();
                case FORMAT -> ((FormatOperation) operation).start();
            };
            return position >= 0 && position <= length;
        }
        if (!operation.isWellFormed()) {
            return false;
        }
        return switch (operation.kind()) {
            case INSERT -> ((InsertOperation) operation).position() <= length;
            case DELETE -> {
                DeleteOperation delete = (DeleteOperation) operation;
                yield delete.position() <= length && delete.length() <= length - delete.position();
            }
            case FORMAT -> ((FormatOperation) operation).end() <= length;
        };
    }

    private record Span(int start, int end) {

        Span after(EditOperation other) {
            if (other instanceof InsertOperation insert) {
                return afterInsert(insert.position(), insert.length());
            }
            if (other instanceof DeleteOperation delete) {
                return afterDelete(delete.position(), delete.length());
            }
            return this;
        }

        Span afterInsert(int position, int length) {
            if (position <= start) {
                return new Span(start + length, end + length);
            }
            if (position < end) {
                return new Span(start, end + length);
            }
            return this;
        }

        Span afterDelete(int position, int length) {
            int deleteEnd = position + length;
            if (deleteEnd <= start) {
                return new Span(Math.max(0, start - length), Math.max(0, end - length));
            }
            if (position < end) {
                int overlap = Math.min(deleteEnd, end) - Math.max(position, start);
                int newStart = Math.min(start, position);
                return new Span(newStart, newStart + Math.max(0, end - start - overlap));
            }
            return this;
        }
    }
}
