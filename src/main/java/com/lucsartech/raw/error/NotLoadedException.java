package com.lucsartech.raw.error;

public class NotLoadedException extends ConversionException {

    public NotLoadedException(String operation) {
        super("Cannot " + operation + ": no source loaded");
    }
}
