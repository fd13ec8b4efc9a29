package com.chatauth.backend.modules.auth.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Credentials issued for one request. Exactly one track is populated: the auth pair
 * (access, refresh and auxiliary cookie) or the one-time-password token.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenSet(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("one_time_password_token") String oneTimePasswordToken,
        @JsonProperty("auth_cookie") String authCookie
) {

    public static TokenSet authPair(String accessToken, String refreshToken, String authCookie) {
        return new TokenSet(accessToken, refreshToken, null, authCookie);
    }

    public static TokenSet oneTimePassword(String oneTimePasswordToken) {
        return new TokenSet(null, null, oneTimePasswordToken, null);
    }

    @JsonIgnore
    public boolean isAuthPair() {
        return accessToken != null && refreshToken != null;
    }

    @JsonIgnore
    public boolean isOneTimePassword() {
        return oneTimePasswordToken != null;
    }
}
