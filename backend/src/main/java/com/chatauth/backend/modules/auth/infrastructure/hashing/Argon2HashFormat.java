package com.chatauth.backend.modules.auth.infrastructure.hashing;

import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import com.chatauth.backend.global.config.HashingProperties;
import com.chatauth.backend.global.error.InvalidHashFormatException;

/**
 * Parsed view of a PHC-style Argon2 string:
 * {@code $argon2id$v=19$m=19456,t=2,p=1$<salt>$<digest>} with unpadded Base64 salt and digest.
 * Only lengths of the salt and digest are kept; verification itself re-reads the string.
 */
public record Argon2HashFormat(
        String type,
        int version,
        int memoryKib,
        int iterations,
        int parallelism,
        int saltLength,
        int digestLength
) {

    public static final String ARGON2ID = "argon2id";

    private static final Set<String> KNOWN_TYPES = Set.of("argon2i", "argon2d", ARGON2ID);
    private static final Set<Integer> KNOWN_VERSIONS = Set.of(0x10, 0x13);
    private static final int DEFAULT_VERSION = 0x10;
    private static final String[] PARAMETER_ORDER = {"m", "t", "p"};

    public static Argon2HashFormat parse(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new InvalidHashFormatException("Stored hash is empty");
        }
        String[] parts = encoded.split("\\$");
        if ((parts.length != 5 && parts.length != 6) || !parts[0].isEmpty()) {
            throw new InvalidHashFormatException("Stored hash does not have the Argon2 segment layout");
        }

        String type = parts[1];
        if (!KNOWN_TYPES.contains(type)) {
            throw new InvalidHashFormatException("Unsupported hash algorithm: " + type);
        }

        int index = 2;
        int version = DEFAULT_VERSION;
        if (parts.length == 6) {
            if (!parts[2].startsWith("v=")) {
                throw new InvalidHashFormatException("Stored hash has no version segment");
            }
            version = parseNumber(parts[2].substring(2), "version");
            if (!KNOWN_VERSIONS.contains(version)) {
                throw new InvalidHashFormatException("Unsupported Argon2 version: " + version);
            }
            index = 3;
        }

        Map<String, Integer> params = parseParameters(parts[index]);
        int saltLength = decode(parts[index + 1], "salt").length;
        int digestLength = decode(parts[index + 2], "digest").length;

        return new Argon2HashFormat(
                type,
                version,
                params.get("m"),
                params.get("t"),
                params.get("p"),
                saltLength,
                digestLength
        );
    }

    /**
     * True when this hash was produced with a different variant or cheaper parameters
     * than the ones currently configured.
     */
    public boolean isWeakerThan(HashingProperties properties) {
        return !ARGON2ID.equals(type)
                || memoryKib < properties.memoryKib()
                || iterations < properties.iterations()
                || parallelism < properties.parallelism()
                || saltLength < properties.saltLength()
                || digestLength < properties.hashLength();
    }

    // exactly m, t, p in that order; anything else is not a hash the encoder can verify
    private static Map<String, Integer> parseParameters(String segment) {
        String[] pairs = segment.split(",", -1);
        if (pairs.length != PARAMETER_ORDER.length) {
            throw new InvalidHashFormatException("Argon2 parameters must be exactly m, t and p");
        }
        Map<String, Integer> params = new HashMap<>();
        for (int i = 0; i < pairs.length; i++) {
            String expected = PARAMETER_ORDER[i];
            if (!pairs[i].startsWith(expected + "=")) {
                throw new InvalidHashFormatException("Argon2 parameter " + (i + 1) + " must be " + expected);
            }
            int value = parseNumber(pairs[i].substring(expected.length() + 1), expected);
            if (value <= 0) {
                throw new InvalidHashFormatException("Argon2 parameter " + expected + " must be positive");
            }
            params.put(expected, value);
        }
        return params;
    }

    private static int parseNumber(String raw, String name) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new InvalidHashFormatException("Argon2 " + name + " is not a number", ex);
        }
    }

    private static byte[] decode(String raw, String name) {
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(raw);
        } catch (IllegalArgumentException ex) {
            throw new InvalidHashFormatException("Argon2 " + name + " is not valid Base64", ex);
        }
        if (bytes.length == 0) {
            throw new InvalidHashFormatException("Argon2 " + name + " is empty");
        }
        return bytes;
    }
}
