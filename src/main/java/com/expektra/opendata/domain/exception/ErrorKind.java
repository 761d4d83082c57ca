package com.expektra.opendata.domain.exception;

public enum ErrorKind {
    INVALID_RANGE,
    UPSTREAM_REJECTED,
    UPSTREAM_UNAVAILABLE,
    DECODE_ERROR,
    STORE_ERROR
}
