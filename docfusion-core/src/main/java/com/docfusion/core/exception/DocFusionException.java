package com.docfusion.core.exception;

/**
 * Base class of every fatal error raised by the documentation pipeline.
 */
public class DocFusionException extends RuntimeException {

    public DocFusionException(String message) {
        super(message);
    }

    public DocFusionException(String message, Throwable cause) {
        super(message, cause);
    }
}
