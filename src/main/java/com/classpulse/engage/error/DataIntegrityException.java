package com.classpulse.engage.error;

public class DataIntegrityException extends EngageException {

    public DataIntegrityException(String code, String message) {
        super(code, message);
    }

    public DataIntegrityException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
