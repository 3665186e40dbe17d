package com.splitttr.realtime.rest;

import com.splitttr.realtime.session.SessionManager;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

public class ExceptionMappers {

    public record ErrorBody(String error) {}

    @Provider
    public static class NotFoundMapper implements ExceptionMapper<SessionManager.NotFoundException> {
        @Override
        public Response toResponse(SessionManager.NotFoundException e) {
            return json(404, e);
        }
    }

    @Provider
    public static class ForbiddenMapper implements ExceptionMapper<SessionManager.ForbiddenException> {
        @Override
        public Response toResponse(SessionManager.ForbiddenException e) {
            return json(403, e);
        }
    }

    @Provider
    public static class ValidationMapper implements ExceptionMapper<SessionManager.ValidationException> {
        @Override
        public Response toResponse(SessionManager.ValidationException e) {
            return json(400, e);
        }
    }

    static Response json(int status, SessionManager.CollaborationException e) {
        String msg = e.getMessage();
        if (msg == null || msg.isBlank()) msg = e.code();
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(new ErrorBody(msg)).build();
    }
}
