package com.splitttr.realtime.operation;

import java.util.List;

/**
 * Snapshot of a collaboratively edited resource: plain text plus formatting ranges.
 */
public record DocumentState(String text, List<FormattingRange> formatting) {

    public DocumentState {
        text = text == null ? "" : text;
        formatting = formatting == null ? List.of() : List.copyOf(formatting);
    }

    public static DocumentState empty() {
        return new DocumentState("", List.of());
    }

    public static DocumentState ofText(String text) {
        return new DocumentState(text, List.of());
    }

    public int length() {
        return text.length();
    }
}
