package com.govcomms.collector.exception;

/**
 * Asset rendering or asset store failure for one scope. Ingested items are kept.
 */
public class RenderException extends CollectorException {

    public RenderException(String message) {
        super("RENDER", message);
    }

    public RenderException(String message, Throwable cause) {
        super("RENDER", message, cause);
    }
}
