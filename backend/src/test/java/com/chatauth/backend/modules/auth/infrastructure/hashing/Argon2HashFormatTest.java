package com.chatauth.backend.modules.auth.infrastructure.hashing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.chatauth.backend.global.config.HashingProperties;
import com.chatauth.backend.global.error.InvalidHashFormatException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class Argon2HashFormatTest {

    // 16-byte salt, 32-byte digest
    private static final String VALID =
            "$argon2id$v=19$m=19456,t=2,p=1$c2FsdHNhbHRzYWx0c2FsdA$ZGlnZXN0ZGlnZXN0ZGlnZXN0ZGlnZXN0ZGlnZXN0MTI";

    @Test
    @DisplayName("parses algorithm, version, costs and lengths")
    void parsesValidHash() {
        Argon2HashFormat format = Argon2HashFormat.parse(VALID);

        assertThat(format.type()).isEqualTo("argon2id");
        assertThat(format.version()).isEqualTo(19);
        assertThat(format.memoryKib()).isEqualTo(19456);
        assertThat(format.iterations()).isEqualTo(2);
        assertThat(format.parallelism()).isEqualTo(1);
        assertThat(format.saltLength()).isEqualTo(16);
        assertThat(format.digestLength()).isEqualTo(32);
    }

    @Test
    @DisplayName("a missing version segment defaults to 0x10")
    void versionIsOptional() {
        Argon2HashFormat format = Argon2HashFormat.parse("$argon2i$m=4096,t=3,p=1$c2FsdHNhbHQ$ZGlnZXN0");

        assertThat(format.type()).isEqualTo("argon2i");
        assertThat(format.version()).isEqualTo(0x10);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "   ",
            "not-a-hash",
            "argon2id$v=19$m=1,t=1,p=1$c2FsdA$ZGln",
            "$scrypt$v=19$m=1,t=1,p=1$c2FsdA$ZGln",
            "$argon2id$v=20$m=1024,t=1,p=1$c2FsdA$ZGln",
            "$argon2id$x=19$m=1024,t=1,p=1$c2FsdA$ZGln",
            "$argon2id$v=19$m=1024,t=1$c2FsdA$ZGln",
            "$argon2id$v=19$m=abc,t=1,p=1$c2FsdA$ZGln",
            "$argon2id$v=19$m=0,t=1,p=1$c2FsdA$ZGln",
            "$argon2id$v=19$m=1024,t=1,p=1$!!!$ZGln",
            "$argon2id$v=19$m=1024,t=1,p=1$c2FsdA$",
            "$argon2id$v=19$m=1024,t=1,p=1$c2FsdA$ZGln$extra",
            "$argon2id$v=19$t=1,m=1024,p=1$c2FsdA$ZGln",
            "$argon2id$v=19$m=1024,t=1,p=1,x=9$c2FsdA$ZGln",
            "$argon2id$v=19$m=1024,t=1,,p=1$c2FsdA$ZGln",
            "$argon2id$v=19$m=1024,m=1024,t=1$c2FsdA$ZGln"
    })
    @DisplayName("rejects malformed strings")
    void rejectsMalformed(String encoded) {
        assertThatThrownBy(() -> Argon2HashFormat.parse(encoded))
                .isInstanceOf(InvalidHashFormatException.class);
    }

    @Test
    @DisplayName("null is rejected as malformed")
    void rejectsNull() {
        assertThatThrownBy(() -> Argon2HashFormat.parse(null))
                .isInstanceOf(InvalidHashFormatException.class)
                .hasMessageContaining("empty");
    }

    @Test
    @DisplayName("cheaper parameters or another variant count as weaker")
    void weakerThan() {
        Argon2HashFormat format = Argon2HashFormat.parse(VALID);

        assertThat(format.isWeakerThan(new HashingProperties(16, 32, 1, 19456, 2, 4, 200))).isFalse();
        assertThat(format.isWeakerThan(new HashingProperties(16, 32, 1, 65536, 2, 4, 200))).isTrue();
        assertThat(format.isWeakerThan(new HashingProperties(16, 32, 1, 19456, 3, 4, 200))).isTrue();
        assertThat(Argon2HashFormat.parse("$argon2i$v=19$m=19456,t=2,p=1$c2FsdHNhbHRzYWx0c2FsdA$ZGlnZXN0ZGlnZXN0ZGlnZXN0ZGlnZXN0ZGlnZXN0MTI")
                .isWeakerThan(new HashingProperties(16, 32, 1, 19456, 2, 4, 200))).isTrue();
    }
}
