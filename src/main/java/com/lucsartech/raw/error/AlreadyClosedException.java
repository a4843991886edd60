package com.lucsartech.raw.error;

public class AlreadyClosedException extends ConversionException {

    public AlreadyClosedException(String operation) {
        super("Cannot " + operation + ": session is closed");
    }
}
