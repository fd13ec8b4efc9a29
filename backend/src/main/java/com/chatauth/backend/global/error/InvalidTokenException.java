package com.chatauth.backend.global.error;

public class InvalidTokenException extends CredentialException {

    public InvalidTokenException(String message, Throwable cause) {
        super("INVALID_TOKEN", message, cause);
    }
}
