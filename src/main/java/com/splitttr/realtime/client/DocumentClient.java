package com.splitttr.realtime.client;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * Document service, the system of record for document text. Sessions read a document once when
 * they start and write its text back after edits.
 */
@RegisterRestClient(configKey = "document-service")
@Path("/api/documents/{documentId}")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public interface DocumentClient {

    String SESSION_HEADER = "X-Collab-Session";

    @GET
    DocumentResponse fetchDocument(@PathParam("documentId") String documentId);

    /**
     * Replaces the stored text. The header names the collaboration session the text comes from.
     */
    @PUT
    DocumentResponse storeContent(@PathParam("documentId") String documentId,
                                  @HeaderParam(SESSION_HEADER) String sessionId,
                                  DocumentUpdateRequest update);
}
