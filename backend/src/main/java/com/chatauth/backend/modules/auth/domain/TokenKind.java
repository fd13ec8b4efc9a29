package com.chatauth.backend.modules.auth.domain;

import com.chatauth.backend.global.error.InvalidTokenKindException;

public enum TokenKind {

    AUTH("auth"),
    ONE_TIME_PASSWORD("one_time_password");

    private final String value;

    TokenKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static TokenKind fromValue(String value) {
        for (TokenKind kind : values()) {
            if (kind.value.equals(value)) {
                return kind;
            }
        }
        throw new InvalidTokenKindException(value);
    }
}
