package com.chatauth.backend.global.error;

public class SigningException extends CredentialException {

    public SigningException(String message, Throwable cause) {
        super("TOKEN_SIGNING_FAILED", message, cause);
    }
}
