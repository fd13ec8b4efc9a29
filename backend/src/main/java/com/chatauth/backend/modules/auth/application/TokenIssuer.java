package com.chatauth.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import com.chatauth.backend.global.config.AuthProperties;
import com.chatauth.backend.global.error.InvalidTokenException;
import com.chatauth.backend.global.error.InvalidTokenKindException;
import com.chatauth.backend.global.error.SigningException;
import com.chatauth.backend.modules.auth.domain.TokenClaims;
import com.chatauth.backend.modules.auth.domain.TokenKind;
import com.chatauth.backend.modules.auth.domain.TokenSet;
import com.chatauth.backend.modules.auth.domain.UserProjection;
import com.chatauth.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Issues HS256-signed JWTs for the auth pair and for one-time-password flows.
 * Signing happens inline; only the auxiliary cookie derivation waits on the hashing pool.
 */
@Service
public class TokenIssuer {

    static final String CLAIM_ID = "id";
    static final String CLAIM_EMAIL = "email";

    private static final Logger log = LoggerFactory.getLogger(TokenIssuer.class);

    private final JwtTokenProvider tokenProvider;
    private final CookieCredentialDeriver cookieCredentialDeriver;
    private final AuthProperties authProperties;
    private final Clock clock;

    public TokenIssuer(
            JwtTokenProvider tokenProvider,
            CookieCredentialDeriver cookieCredentialDeriver,
            AuthProperties authProperties,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.cookieCredentialDeriver = cookieCredentialDeriver;
        this.authProperties = authProperties;
        this.clock = clock;
    }

    /**
     * Resolves the wire name ({@code auth} or {@code one_time_password}) and issues tokens.
     *
     * @throws InvalidTokenKindException for any other name
     */
    public CompletableFuture<TokenSet> generate(String kind, UserProjection user) {
        return generate(TokenKind.fromValue(kind), user);
    }

    /**
     * Caller defects ({@code null} kind) and signing failures are thrown directly; a hashing
     * failure while deriving the auth cookie completes the returned future exceptionally.
     */
    public CompletableFuture<TokenSet> generate(TokenKind kind, UserProjection user) {
        if (kind == null) {
            throw new InvalidTokenKindException(null);
        }
        Objects.requireNonNull(user, "user");
        long now = clock.instant().getEpochSecond();

        log.debug("Issuing {} tokens for user {}", kind.value(), user.id());
        return switch (kind) {
            case AUTH -> issueAuthPair(user, now);
            case ONE_TIME_PASSWORD -> CompletableFuture.completedFuture(TokenSet.oneTimePassword(
                    sign(claims(user, now, Duration.ofMinutes(authProperties.otpExpiryMinutes())))));
        };
    }

    /**
     * Verifies the signature and expiry of a token issued here and returns its claims.
     */
    public TokenClaims parse(String token) {
        try {
            Claims claims = Jwts.parser()
                    .sig().add(tokenProvider.getSigningAlgorithm()).and()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            long id = userId(claims);
            String email = claims.get(CLAIM_EMAIL, String.class);
            if (claims.getIssuedAt() == null || claims.getExpiration() == null) {
                throw new InvalidTokenException("Token has no validity window", null);
            }
            return new TokenClaims(
                    id,
                    email,
                    claims.getIssuedAt().toInstant().getEpochSecond(),
                    claims.getExpiration().toInstant().getEpochSecond()
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid token", e);
        }
    }

    // tokens from older issuers carry only the numeric id claim, newer ones also set sub
    private static long userId(Claims claims) {
        if (claims.get(CLAIM_ID) instanceof Number id) {
            return id.longValue();
        }
        if (claims.getSubject() == null) {
            throw new InvalidTokenException("Token does not identify a user", null);
        }
        return Long.parseLong(claims.getSubject());
    }

    private CompletableFuture<TokenSet> issueAuthPair(UserProjection user, long now) {
        String accessToken = sign(claims(user, now, Duration.ofHours(authProperties.accessExpiryHours())));
        String refreshToken = sign(claims(user, now, Duration.ofHours(authProperties.refreshExpiryHours())));

        return cookieCredentialDeriver.derive(user.email(), authProperties.secret())
                .thenApply(cookie -> TokenSet.authPair(accessToken, refreshToken, cookie));
    }

    private static TokenClaims claims(UserProjection user, long now, Duration lifetime) {
        return new TokenClaims(user.id(), user.email(), now, now + lifetime.getSeconds());
    }

    private String sign(TokenClaims claims) {
        try {
            return Jwts.builder()
                    .header().type("JWT").and()
                    .subject(Long.toString(claims.id()))
                    .claim(CLAIM_ID, claims.id())
                    .claim(CLAIM_EMAIL, claims.email())
                    .issuedAt(Date.from(Instant.ofEpochSecond(claims.issuedAt())))
                    .expiration(Date.from(Instant.ofEpochSecond(claims.expiresAt())))
                    .signWith(tokenProvider.getSecretKey(), tokenProvider.getSigningAlgorithm())
                    .compact();
        } catch (JwtException | IllegalArgumentException e) {
            throw new SigningException("Failed to sign token for user " + claims.id(), e);
        }
    }
}
