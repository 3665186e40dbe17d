package com.splitttr.realtime.client;

import com.splitttr.realtime.operation.DocumentState;
import com.splitttr.realtime.operation.FormattingRange;
import com.splitttr.realtime.operation.TextFormat;
import com.splitttr.realtime.session.ResourceType;
import com.splitttr.realtime.session.SessionSnapshot;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DocumentServiceGatewayTest {

    @Mock
    DocumentClient documentClient;

    private DocumentServiceGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new DocumentServiceGateway();
        gateway.documentClient = documentClient;
    }

    private static WebApplicationException httpError(int status) {
        Response response = mock(Response.class);
        when(response.getStatus()).thenReturn(status);
        WebApplicationException error = mock(WebApplicationException.class);
        when(error.getResponse()).thenReturn(response);
        return error;
    }

    @Test
    @DisplayName("document sessions start from the stored text")
    void loadsDocument() {
        when(documentClient.fetchDocument("doc-1"))
            .thenReturn(new DocumentResponse("doc-1", "Notes", "Hello", 3L, Instant.parse("2024-05-01T10:00:00Z")));

        assertThat(gateway.getResourceState("doc-1", ResourceType.DOCUMENT))
            .contains(DocumentState.ofText("Hello"));
    }

    @Test
    @DisplayName("a missing document means an empty start")
    void missingDocument() {
        WebApplicationException notFound = httpError(404);
        when(documentClient.fetchDocument("doc-1")).thenThrow(notFound);

        assertThat(gateway.getResourceState("doc-1", ResourceType.DOCUMENT)).isEmpty();
    }

    @Test
    @DisplayName("other service errors propagate")
    void serviceError() {
        WebApplicationException unavailable = httpError(503);
        when(documentClient.fetchDocument("doc-1")).thenThrow(unavailable);

        assertThatThrownBy(() -> gateway.getResourceState("doc-1", ResourceType.DOCUMENT)).isSameAs(unavailable);
    }

    @Test
    @DisplayName("conversations and artifacts are not loaded or stored here")
    void otherResourceTypes() {
        Instant at = Instant.parse("2024-05-01T10:00:00Z");
        SessionSnapshot conversation = new SessionSnapshot("s-1", "conv-1", ResourceType.CONVERSATION, "ws-1",
            List.of(), DocumentState.ofText("x"), List.of(), 1, at, at);

        assertThat(gateway.getResourceState("conv-1", ResourceType.CONVERSATION)).isEmpty();
        gateway.persistSession(conversation);

        verifyNoInteractions(documentClient);
    }

    @Test
    @DisplayName("document snapshots are written back as text, tagged with their session")
    void storesText() {
        Instant at = Instant.parse("2024-05-01T10:00:00Z");
        DocumentState state = new DocumentState("Hello!", List.of(new FormattingRange(0, 5, TextFormat.boldText())));
        SessionSnapshot snapshot = new SessionSnapshot("s-1", "doc-1", ResourceType.DOCUMENT, "ws-1",
            List.of("alice"), state, List.of(), 4, at, at);

        gateway.persistSession(snapshot);

        verify(documentClient).storeContent("doc-1", "s-1", new DocumentUpdateRequest(null, "Hello!"));
    }
}
