package com.chatauth.backend.global.error;

public class HashingException extends CredentialException {

    public HashingException(String message, Throwable cause) {
        super("HASHING_FAILED", message, cause);
    }
}
