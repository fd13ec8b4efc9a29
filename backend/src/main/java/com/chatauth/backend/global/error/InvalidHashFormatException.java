package com.chatauth.backend.global.error;

/**
 * A stored password hash could not be parsed. Treated as a failed login for the user
 * and as a data-integrity problem for operators.
 */
public class InvalidHashFormatException extends CredentialException {

    public InvalidHashFormatException(String message) {
        super("INVALID_HASH_FORMAT", message);
    }

    public InvalidHashFormatException(String message, Throwable cause) {
        super("INVALID_HASH_FORMAT", message, cause);
    }
}
