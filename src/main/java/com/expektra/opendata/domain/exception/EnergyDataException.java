package com.expektra.opendata.domain.exception;

/**
 * Base of every failure surfaced by the cache. Callers branch on {@link #kind()}.
 */
public abstract class EnergyDataException extends RuntimeException {

    protected EnergyDataException(String message) {
        super(message);
    }

    protected EnergyDataException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
