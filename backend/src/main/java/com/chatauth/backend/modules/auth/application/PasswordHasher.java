package com.chatauth.backend.modules.auth.application;

import static com.chatauth.backend.global.config.PasswordHashingExecutorConfig.PASSWORD_HASHING_EXECUTOR;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

import com.chatauth.backend.global.config.HashingProperties;
import com.chatauth.backend.global.error.HashingException;
import com.chatauth.backend.global.error.InvalidHashFormatException;
import com.chatauth.backend.modules.auth.infrastructure.hashing.Argon2HashFormat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * Argon2id hashing and verification. Every computation runs on the bounded
 * password-hashing pool and is handed back through the returned future; cancelling
 * that future does not interrupt a computation already running.
 */
@Service
public class PasswordHasher {

    private static final Logger log = LoggerFactory.getLogger(PasswordHasher.class);
    private static final String DUMMY_PLAINTEXT = "chat-auth-unknown-account";
    private static final int LOGGED_PREFIX_LENGTH = 12;

    private final Argon2PasswordEncoder encoder;
    private final HashingProperties properties;
    private final Executor executor;
    private final String dummyHash;

    public PasswordHasher(
            HashingProperties properties,
            @Qualifier(PASSWORD_HASHING_EXECUTOR) Executor executor
    ) {
        this.properties = properties;
        this.executor = executor;
        this.encoder = new Argon2PasswordEncoder(
                properties.saltLength(),
                properties.hashLength(),
                properties.parallelism(),
                properties.memoryKib(),
                properties.iterations()
        );
        this.dummyHash = encoder.encode(DUMMY_PLAINTEXT);
    }

    /**
     * Hashes {@code plaintext} with a fresh random salt. The result is a self-describing
     * {@code $argon2id$v=19$...} string, so two calls on the same input never match.
     */
    public CompletableFuture<String> hash(String plaintext) {
        Objects.requireNonNull(plaintext, "plaintext");
        return offload(() -> encode(plaintext));
    }

    /**
     * Checks {@code plaintext} against a stored hash using the parameters embedded in it.
     * Completes with {@code false} on a mismatch and exceptionally with
     * {@link InvalidHashFormatException} when the stored string cannot be parsed.
     */
    public CompletableFuture<Boolean> verify(String plaintext, String storedHash) {
        Objects.requireNonNull(plaintext, "plaintext");
        try {
            Argon2HashFormat.parse(storedHash);
        } catch (InvalidHashFormatException ex) {
            log.warn("Stored password hash is malformed (prefix={}): {}", safePrefix(storedHash), ex.getMessage());
            return CompletableFuture.failedFuture(ex);
        }
        return offload(() -> matches(plaintext, storedHash));
    }

    /**
     * Like {@link #verify} but tolerates a missing hash, which is what an unknown account
     * looks like upstream. The plaintext is then checked against a fixed dummy hash so the
     * call costs the same, and the result is always {@code false}.
     */
    public CompletableFuture<Boolean> verifyOrDummy(String plaintext, String storedHash) {
        if (storedHash == null) {
            return verify(plaintext, dummyHash).thenApply(ignored -> false);
        }
        return verify(plaintext, storedHash);
    }

    public boolean needsRehash(String storedHash) {
        return Argon2HashFormat.parse(storedHash).isWeakerThan(properties);
    }

    private String encode(String plaintext) {
        try {
            return encoder.encode(plaintext);
        } catch (RuntimeException ex) {
            throw new HashingException("Argon2 rejected the input", ex);
        }
    }

    private boolean matches(String plaintext, String storedHash) {
        try {
            return encoder.matches(plaintext, storedHash);
        } catch (RuntimeException ex) {
            throw new HashingException("Argon2 verification failed", ex);
        }
    }

    private <T> CompletableFuture<T> offload(Supplier<T> task) {
        try {
            return CompletableFuture.supplyAsync(task, executor);
        } catch (RejectedExecutionException ex) {
            log.warn("Password hashing pool is saturated, rejecting request");
            return CompletableFuture.failedFuture(new HashingException("Password hashing pool is saturated", ex));
        }
    }

    private static String safePrefix(String storedHash) {
        if (storedHash == null) {
            return "null";
        }
        return storedHash.length() <= LOGGED_PREFIX_LENGTH ? storedHash : storedHash.substring(0, LOGGED_PREFIX_LENGTH);
    }
}
