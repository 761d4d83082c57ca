package com.expektra.opendata.domain.exception;

/**
 * Upstream payload did not match the series schema. Fails the whole fetch.
 */
public class DecodeException extends EnergyDataException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DECODE_ERROR;
    }
}
