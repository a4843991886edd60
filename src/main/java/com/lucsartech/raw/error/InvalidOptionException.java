package com.lucsartech.raw.error;

/**
 * Out-of-range or malformed conversion options. Always raised before any decode or encode work.
 */
public class InvalidOptionException extends ConversionException {

    public InvalidOptionException(String message) {
        super(message);
    }
}
