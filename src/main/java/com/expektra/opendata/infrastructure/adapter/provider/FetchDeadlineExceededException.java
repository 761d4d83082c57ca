package com.expektra.opendata.infrastructure.adapter.provider;

import com.expektra.opendata.domain.exception.UpstreamUnavailableException;

/**
 * A gap fetch ran past its deadline. Not retried.
 */
public class FetchDeadlineExceededException extends UpstreamUnavailableException {

    public FetchDeadlineExceededException(String message) {
        super(message);
    }

    public FetchDeadlineExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
