package com.classpulse.engage.error;

public class NotFoundException extends EngageException {

    public NotFoundException(String code, String message) {
        super(code, message);
    }
}
