package com.lucsartech.raw.error;

/**
 * A batch could not start at all, e.g. the output directory cannot be created.
 * Per-item failures never surface as this type.
 */
public class BatchSetupException extends ConversionException {

    public BatchSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
