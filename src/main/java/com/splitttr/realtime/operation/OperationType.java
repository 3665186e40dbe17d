package com.splitttr.realtime.operation;

public enum OperationType {
    INSERT,
    DELETE,
    FORMAT
}
