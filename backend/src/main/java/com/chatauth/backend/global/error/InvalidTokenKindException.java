package com.chatauth.backend.global.error;

public class InvalidTokenKindException extends CredentialException {

    private final String kind;

    public InvalidTokenKindException(String kind) {
        super("INVALID_TOKEN_KIND", "Invalid token type: " + kind);
        this.kind = kind;
    }

    public String getKind() {
        return kind;
    }
}
