package com.chatauth.backend.global.error;

/**
 * Base type for failures raised by the credential core. The {@code code} is a stable
 * identifier callers can map to a response; the message is for operators only.
 */
public class CredentialException extends RuntimeException {

    private final String code;

    public CredentialException(String code, String message) {
        this(code, message, null);
    }

    public CredentialException(String code, String message, Throwable cause) {
        super(message, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("CredentialException code must not be blank");
        }
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
