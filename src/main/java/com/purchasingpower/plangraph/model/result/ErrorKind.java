package com.purchasingpower.plangraph.model.result;

public enum ErrorKind {
    SYNTAX_ERROR,
    INVALID_IDENTIFIER,
    UNRESOLVED_TYPE,
    MULTIPLE_INPUT_TYPES,
    FORMAT_ERROR,
    INVALID_PAYLOAD,
    IO_ERROR,
    INTERNAL_ERROR
}
