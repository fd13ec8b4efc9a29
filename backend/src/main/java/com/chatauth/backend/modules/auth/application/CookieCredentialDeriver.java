package com.chatauth.backend.modules.auth.application;

import java.util.concurrent.CompletableFuture;

import org.springframework.stereotype.Service;

/**
 * Builds the opaque value carried by the auth cookie: the email hash and the secret hash,
 * each freshly salted, joined under a fixed tag. Nothing verifies this value later and it
 * differs on every call; session validity rests on the signed tokens.
 */
@Service
public class CookieCredentialDeriver {

    public static final String PREFIX = "chat_auth";
    public static final String DELIMITER = "____";

    private final PasswordHasher passwordHasher;

    public CookieCredentialDeriver(PasswordHasher passwordHasher) {
        this.passwordHasher = passwordHasher;
    }

    public CompletableFuture<String> derive(String email, String secret) {
        CompletableFuture<String> emailHash = passwordHasher.hash(email);
        CompletableFuture<String> secretHash = passwordHasher.hash(secret);
        return emailHash.thenCombine(secretHash, (a, b) -> PREFIX + DELIMITER + a + DELIMITER + b);
    }
}
