package io.recallr.memory;

/**
 * Failure categories raised by the memory engine.
 */
public enum ErrorCode {
    NULL_INPUT,
    INVALID_INPUT,
    NOT_FOUND,
    IO_ERROR,
    OUT_OF_MEMORY,
    INVALID_STATE,
    RESOURCE_LIMIT,
    STORAGE_FULL,
    PARSE_ERROR
}
