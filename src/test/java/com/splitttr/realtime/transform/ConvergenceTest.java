package com.splitttr.realtime.transform;

import com.splitttr.realtime.message.ServerMessage;
import com.splitttr.realtime.operation.DeleteOperation;
import com.splitttr.realtime.operation.DocumentState;
import com.splitttr.realtime.operation.EditOperation;
import com.splitttr.realtime.operation.FormatOperation;
import com.splitttr.realtime.operation.FormattingRange;
import com.splitttr.realtime.operation.InsertOperation;
import com.splitttr.realtime.operation.TextFormat;
import com.splitttr.realtime.session.CollaborationSession;
import com.splitttr.realtime.session.ResourceType;
import com.splitttr.realtime.session.RetrySettings;
import com.splitttr.realtime.session.SessionManager;
import com.splitttr.realtime.session.SessionPersister;
import com.splitttr.realtime.session.SessionSettings;
import com.splitttr.realtime.support.MutableClock;
import com.splitttr.realtime.support.RecordingDispatcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Concurrent edits from a common base, admitted in every possible order, must leave the session
 * in the same state, and a passive participant replaying the broadcasts must end up there too.
 * Edits freely overlap, touch and repeat each other.
 */
class ConvergenceTest {

    private static final String BASE = "Hello World";
    private static final String OBSERVER = "observer";

    private final ConflictResolver resolver = new ConflictResolver();
    private final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
    private SessionPersister persister;

    @BeforeEach
    void setUp() {
        persister = new SessionPersister(snapshot -> { }, RetrySettings.defaults());
    }

    @AfterEach
    void tearDown() {
        persister.close();
    }

    @Test
    @DisplayName("2 to 4 authors with overlapping edits converge under every arrival order")
    void overlappingEditsConverge() {
        Random random = new Random(20240501L);

        for (int trial = 0; trial < 150; trial++) {
            int authors = 2 + random.nextInt(3);
            List<EditOperation> edits = new ArrayList<>();
            for (int author = 0; author < authors; author++) {
                edits.add(randomEdit("user-" + author, 1_000L + author, random));
            }

            DocumentState expected = null;
            for (List<EditOperation> order : permutations(edits)) {
                Outcome outcome = admitInOrder(order, authors);

                assertThat(outcome.replayed().text()).as("replayed text for %s", order)
                    .isEqualTo(outcome.server().text());
                assertThat(outcome.replayed().formatting()).as("replayed formatting for %s", order)
                    .containsExactlyInAnyOrderElementsOf(outcome.server().formatting());

                if (expected == null) {
                    expected = outcome.server();
                } else {
                    assertThat(outcome.server().text()).as("text for %s", order).isEqualTo(expected.text());
                    assertThat(outcome.server().formatting()).as("formatting for %s", order)
                        .containsExactlyInAnyOrderElementsOf(expected.formatting());
                }
            }
        }
    }

    @Test
    @DisplayName("two authors deleting the same word converge on one deletion")
    void sameDeleteTwice() {
        EditOperation first = DeleteOperation.of("user-0", 1_000L, 0, 5).basedOn(0L);
        EditOperation second = DeleteOperation.of("user-1", 1_001L, 0, 5).basedOn(0L);

        Outcome oneWay = admitInOrder(List.of(first, second), 2);
        Outcome otherWay = admitInOrder(List.of(second, first), 2);

        assertThat(oneWay.server().text()).isEqualTo(" World");
        assertThat(otherWay.server().text()).isEqualTo(" World");
        assertThat(oneWay.replayed().text()).isEqualTo(" World");
    }

    @Test
    @DisplayName("an insert next to a concurrently deleted word goes with it in every order")
    void insertTouchingDelete() {
        EditOperation before = InsertOperation.of("user-0", 1_000L, 0, "x").basedOn(0L);
        EditOperation delete = DeleteOperation.of("user-1", 1_001L, 0, 5).basedOn(0L);
        EditOperation after = InsertOperation.of("user-2", 1_002L, 5, "y").basedOn(0L);

        for (List<EditOperation> order : permutations(List.of(before, delete, after))) {
            Outcome outcome = admitInOrder(order, 3);

            assertThat(outcome.server().text()).as("text for %s", order).isEqualTo(" World");
            assertThat(outcome.replayed().text()).isEqualTo(" World");
        }
    }

    @Test
    @DisplayName("two authors typing at opposite ends converge")
    void oppositeEnds() {
        EditOperation front = InsertOperation.of("user-0", 1_000L, 0, ">> ").basedOn(0L);
        EditOperation back = InsertOperation.of("user-1", 1_001L, BASE.length(), " <<").basedOn(0L);

        Outcome first = admitInOrder(List.of(front, back), 2);
        Outcome second = admitInOrder(List.of(back, front), 2);

        assertThat(first.server().text()).isEqualTo(">> " + BASE + " <<");
        assertThat(second.server().text()).isEqualTo(first.server().text());
        assertThat(first.replayed().text()).isEqualTo(first.server().text());
    }

    private Outcome admitInOrder(List<EditOperation> order, int authors) {
        RecordingDispatcher dispatcher = new RecordingDispatcher();
        SessionManager manager = new SessionManager(resolver,
            (resourceId, type) -> Optional.of(DocumentState.ofText(BASE)),
            (session, userId) -> true,
            persister, dispatcher, SessionSettings.defaults(), clock);

        CollaborationSession session = manager.createSession("doc-1", ResourceType.DOCUMENT, OBSERVER, "ws-1");
        for (int author = 0; author < authors; author++) {
            manager.joinSession(session.getId(), "user-" + author);
        }
        for (EditOperation edit : order) {
            clock.advance(Duration.ofMillis(5));
            manager.handleOperation(session.getId(), edit, edit.userId());
        }

        DocumentState replayed = DocumentState.ofText(BASE);
        for (ServerMessage message : dispatcher.to(OBSERVER, ServerMessage.Type.OPERATION)) {
            replayed = replay(replayed, message.operation());
        }
        return new Outcome(session.getState(), replayed);
    }

    private DocumentState replay(DocumentState state, EditOperation op) {
        List<FormattingRange> formatting = new ArrayList<>();
        for (FormattingRange range : state.formatting()) {
            FormattingRange moved = resolver.rebase(range, op);
            if (!moved.isEmpty()) {
                formatting.add(moved);
            }
        }
        String text = state.text();
        if (op instanceof InsertOperation insert) {
            text = text.substring(0, insert.position()) + insert.text() + text.substring(insert.position());
            if (insert.format() != null) {
                formatting.add(new FormattingRange(insert.position(), insert.position() + insert.length(), insert.format()));
            }
        } else if (op instanceof DeleteOperation delete) {
            text = text.substring(0, delete.position()) + text.substring(delete.end());
        } else if (op instanceof FormatOperation format) {
            formatting.add(format.toRange());
        }
        return new DocumentState(text, formatting);
    }

    /**
     * One edit anywhere in the base text. Small texts make overlaps, shared edges and identical
     * edits common.
     */
    private static EditOperation randomEdit(String userId, long timestamp, Random random) {
        int length = BASE.length();
        switch (random.nextInt(3)) {
            case 0: {
                int position = random.nextInt(length + 1);
                String text = "xyz".substring(0, 1 + random.nextInt(3));
                TextFormat format = random.nextInt(3) == 0 ? TextFormat.italicText() : null;
                return new InsertOperation(null, null, userId, timestamp, 0L, null, position, text, format, false);
            }
            case 1: {
                int position = random.nextInt(length);
                int size = 1 + random.nextInt(Math.min(5, length - position));
                return DeleteOperation.of(userId, timestamp, position, size).basedOn(0L);
            }
            default: {
                int start = random.nextInt(length);
                int end = start + 1 + random.nextInt(Math.min(5, length - start));
                TextFormat format = random.nextBoolean() ? TextFormat.boldText() : TextFormat.italicText();
                return FormatOperation.of(userId, timestamp, start, end, format).basedOn(0L);
            }
        }
    }

    private static <T> List<List<T>> permutations(List<T> items) {
        if (items.size() <= 1) {
            return List.of(List.copyOf(items));
        }
        List<List<T>> result = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            List<T> rest = new ArrayList<>(items);
            T head = rest.remove(i);
            for (List<T> tail : permutations(rest)) {
                List<T> permutation = new ArrayList<>();
                permutation.add(head);
                permutation.addAll(tail);
                result.add(permutation);
            }
        }
        return result;
    }

    private record Outcome(DocumentState server, DocumentState replayed) {}
}
