package com.splitttr.realtime.operation;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TextFormat(
    Boolean bold,
    Boolean italic,
    Boolean underline,
    Boolean strikethrough,
    String color,
    String backgroundColor,
    Integer fontSize,
    String fontFamily
) {
    public static TextFormat boldText() {
        return new TextFormat(true, null, null, null, null, null, null, null);
    }

    public static TextFormat italicText() {
        return new TextFormat(null, true, null, null, null, null, null, null);
    }
}
