package com.expektra.opendata.domain.exception;

/**
 * Request rejected before any gap computation: bad range, unknown zone or series, bad paging input.
 */
public class InvalidRangeException extends EnergyDataException {

    public InvalidRangeException(String message) {
        super(message);
    }

    public InvalidRangeException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INVALID_RANGE;
    }
}
