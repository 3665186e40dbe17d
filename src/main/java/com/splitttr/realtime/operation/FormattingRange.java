package com.splitttr.realtime.operation;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record FormattingRange(int start, int end, TextFormat format) {

    @JsonIgnore
    public boolean isEmpty() {
        return end <= start;
    }
}
