package com.lucsartech.raw.error;

/**
 * Source could not be loaded: unreadable, unsupported, corrupt,
 * or the session was not in a state that accepts a load.
 */
public class LoadException extends ConversionException {

    public LoadException(String message) {
        super(message);
    }

    public LoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
