package com.arriraw.error;

/**
 * Types of errors that can occur while reading ARRIRAW header metadata.
 */
public enum ErrorType {
    SOURCE_NOT_FOUND,
    INVALID_BUFFER_TYPE,
    OUT_OF_RANGE,
    INVALID_DATATYPE,
    INVALID_DESCRIPTOR,
    CATALOG_ERROR,
    CONFIG_ERROR,
    NO_MATCHING_FILES,
    IO_ERROR
}
