package com.splitttr.realtime.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON framing for the collaboration socket: one object per text frame.
 */
public class MessageCodec {

    private final ObjectMapper mapper;

    public MessageCodec() {
        this(new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    public MessageCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(ServerMessage message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode " + message.type() + " message", e);
        }
    }

    public ClientMessage decode(String frame) {
        if (frame == null || frame.isBlank()) {
            throw new MalformedMessageException("Empty frame", null);
        }
        ClientMessage message;
        try {
            message = mapper.readValue(frame, ClientMessage.class);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException(e.getOriginalMessage(), e);
        }
        if (message == null || message.type() == null) {
            throw new MalformedMessageException("Missing message type", null);
        }
        return message;
    }
}
