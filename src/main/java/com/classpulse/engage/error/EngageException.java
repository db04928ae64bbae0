package com.classpulse.engage.error;

/**
 * Base class for failures surfaced to callers. The code is stable and safe to expose in API responses.
 */
public abstract class EngageException extends RuntimeException {
    private final String code;

    protected EngageException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected EngageException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
