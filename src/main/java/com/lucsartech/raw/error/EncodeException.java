package com.lucsartech.raw.error;

/**
 * Encoder failed for a specific format, including formats the running platform cannot write.
 */
public class EncodeException extends ConversionException {

    public EncodeException(String message) {
        super(message);
    }

    public EncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
