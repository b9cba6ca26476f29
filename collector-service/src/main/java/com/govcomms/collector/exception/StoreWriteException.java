package com.govcomms.collector.exception;

public class StoreWriteException extends CollectorException {

    public StoreWriteException(String message, Throwable cause) {
        super("STORE_WRITE", message, cause);
    }
}
