package com.splitttr.realtime.client;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Partial update; a null title leaves the stored title alone.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DocumentUpdateRequest(String title, String content) {

    public static DocumentUpdateRequest content(String content) {
        return new DocumentUpdateRequest(null, content);
    }
}
