package com.chatauth.backend.modules.auth.presentation;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import com.chatauth.backend.global.config.AppProperties;
import com.chatauth.backend.global.config.AuthProperties;

import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/**
 * Writes the auxiliary auth cookie onto an outgoing response.
 * HttpOnly and SameSite=Lax always; Secure everywhere except the development environment.
 */
@Component
public class AuthCookieDeployer {

    public static final String COOKIE_NAME = "chat_auth_cookie";

    private static final Logger log = LoggerFactory.getLogger(AuthCookieDeployer.class);
    private static final String COOKIE_PATH = "/";
    private static final String SAME_SITE_LAX = "Lax";

    private final AuthProperties authProperties;
    private final AppProperties appProperties;

    public AuthCookieDeployer(AuthProperties authProperties, AppProperties appProperties) {
        this.authProperties = authProperties;
        this.appProperties = appProperties;
    }

    /**
     * Attaches the cookie; it lives as long as the refresh token. The value is URL-encoded
     * because derived values contain characters RFC 6265 does not allow in a cookie.
     *
     * @return the directive that was written
     */
    public ResponseCookie deploy(HttpServletResponse response, String cookieValue) {
        if (cookieValue == null || cookieValue.isEmpty()) {
            throw new IllegalArgumentException("Cookie value must not be empty");
        }
        ResponseCookie cookie = cookie(URLEncoder.encode(cookieValue, StandardCharsets.UTF_8),
                Duration.ofHours(authProperties.refreshExpiryHours()));
        attach(response, cookie);
        log.debug("Deployed auth cookie: secure={}, maxAge={}s", cookie.isSecure(), cookie.getMaxAge().getSeconds());
        return cookie;
    }

    /**
     * Expires the cookie on the client, e.g. on logout.
     */
    public ResponseCookie clear(HttpServletResponse response) {
        ResponseCookie cookie = cookie("", Duration.ZERO);
        attach(response, cookie);
        log.debug("Cleared auth cookie");
        return cookie;
    }

    private ResponseCookie cookie(String value, Duration maxAge) {
        return ResponseCookie.from(COOKIE_NAME, value)
                .path(COOKIE_PATH)
                .httpOnly(true)
                .secure(!appProperties.isDevelopment())
                .sameSite(SAME_SITE_LAX)
                .maxAge(maxAge)
                .build();
    }

    private static void attach(HttpServletResponse response, ResponseCookie cookie) {
        if (response == null) {
            throw new IllegalStateException("No response available to attach the auth cookie to");
        }
        if (response.isCommitted()) {
            throw new IllegalStateException("Response already committed, cannot attach the auth cookie");
        }
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }
}
