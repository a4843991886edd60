package com.lucsartech.raw.error;

/**
 * Native decode failed. The owning session stays loaded and the decode may be retried.
 */
public class DecodeException extends ConversionException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
