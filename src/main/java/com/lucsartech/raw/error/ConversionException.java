package com.lucsartech.raw.error;

/**
 * Base type for every failure raised by the conversion layer.
 * Subclasses let callers tell "fix my options" apart from "this file is corrupt"
 * and "this encoder is unavailable".
 */
public class ConversionException extends RuntimeException {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
