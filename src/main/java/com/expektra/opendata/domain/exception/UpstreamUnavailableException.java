package com.expektra.opendata.domain.exception;

/**
 * Upstream could not be reached in time: retries exhausted, deadline passed or circuit open.
 */
public class UpstreamUnavailableException extends EnergyDataException {

    public UpstreamUnavailableException(String message) {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.UPSTREAM_UNAVAILABLE;
    }
}
