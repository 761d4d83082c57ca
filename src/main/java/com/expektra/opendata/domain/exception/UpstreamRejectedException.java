package com.expektra.opendata.domain.exception;

/**
 * Upstream answered with a 4xx. Never retried.
 */
public class UpstreamRejectedException extends EnergyDataException {

    private final int status;

    public UpstreamRejectedException(String message, int status) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.UPSTREAM_REJECTED;
    }
}
