package com.expektra.opendata.domain.exception;

public class StoreException extends EnergyDataException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.STORE_ERROR;
    }
}
