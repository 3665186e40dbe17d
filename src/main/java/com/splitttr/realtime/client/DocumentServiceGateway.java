package com.splitttr.realtime.client;

import com.splitttr.realtime.operation.DocumentState;
import com.splitttr.realtime.session.ResourceStateProvider;
import com.splitttr.realtime.session.ResourceType;
import com.splitttr.realtime.session.SessionSnapshot;
import com.splitttr.realtime.session.SessionStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.WebApplicationException;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * Seeds and stores document sessions through the document service. Conversations and artifacts
 * live elsewhere, so their sessions start empty and are kept in memory only. The document service
 * stores plain text; formatting ranges are not written back.
 */
@ApplicationScoped
public class DocumentServiceGateway implements ResourceStateProvider, SessionStore {

    private static final Logger LOG = Logger.getLogger(DocumentServiceGateway.class);

    @Inject
    @RestClient
    DocumentClient documentClient;

    @Override
    public Optional<DocumentState> getResourceState(String resourceId, ResourceType resourceType) {
        if (resourceType != ResourceType.DOCUMENT) {
            return Optional.empty();
        }
        try {
            DocumentResponse document = documentClient.fetchDocument(resourceId);
            LOG.debugf("Loaded document %s at version %d", resourceId, document.version());
            return Optional.of(DocumentState.ofText(document.content()));
        } catch (WebApplicationException e) {
            if (e.getResponse() != null && e.getResponse().getStatus() == 404) {
                LOG.infof("Document %s does not exist yet", resourceId);
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public void persistSession(SessionSnapshot snapshot) {
        if (snapshot.resourceType() != ResourceType.DOCUMENT) {
            return;
        }
        documentClient.storeContent(snapshot.resourceId(), snapshot.id(),
            DocumentUpdateRequest.content(snapshot.state().text()));
    }
}
