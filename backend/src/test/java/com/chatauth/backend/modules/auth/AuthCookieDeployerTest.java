package com.chatauth.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

import com.chatauth.backend.modules.auth.presentation.AuthCookieDeployer;
import com.chatauth.backend.support.CredentialTestSupport;

import jakarta.servlet.http.Cookie;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockCookie;
import org.springframework.mock.web.MockHttpServletResponse;

class AuthCookieDeployerTest {

    private final AuthCookieDeployer developmentDeployer = new AuthCookieDeployer(
            CredentialTestSupport.authProperties(), CredentialTestSupport.environment("development"));
    private final AuthCookieDeployer productionDeployer = new AuthCookieDeployer(
            CredentialTestSupport.authProperties(), CredentialTestSupport.environment("production"));

    @Test
    @DisplayName("development: HttpOnly, not Secure, SameSite=Lax, lives as long as the refresh token")
    void developmentCookie() {
        MockHttpServletResponse response = new MockHttpServletResponse();

        developmentDeployer.deploy(response, "abc");

        MockCookie cookie = (MockCookie) response.getCookie(AuthCookieDeployer.COOKIE_NAME);
        assertThat(cookie).isNotNull();
        assertThat(cookie.getValue()).isEqualTo("abc");
        assertThat(cookie.isHttpOnly()).isTrue();
        assertThat(cookie.getSecure()).isFalse();
        assertThat(cookie.getSameSite()).isEqualTo("Lax");
        assertThat(cookie.getMaxAge()).isEqualTo(86400);
        assertThat(cookie.getPath()).isEqualTo("/");
        assertThat(response.getHeader(HttpHeaders.SET_COOKIE))
                .contains("HttpOnly")
                .contains("SameSite=Lax")
                .doesNotContain("Secure");
    }

    @Test
    @DisplayName("any other environment marks the cookie Secure")
    void productionCookie() {
        MockHttpServletResponse response = new MockHttpServletResponse();

        productionDeployer.deploy(response, "abc");

        Cookie cookie = response.getCookie(AuthCookieDeployer.COOKIE_NAME);
        assertThat(cookie.getSecure()).isTrue();
        assertThat(cookie.isHttpOnly()).isTrue();
        assertThat(cookie.getMaxAge()).isEqualTo(86400);
    }

    @Test
    @DisplayName("derived values are URL-encoded so the header stays RFC 6265 compliant")
    void encodesDerivedValue() {
        String derived = "chat_auth____$argon2id$v=19$m=1024,t=1,p=1$c2FsdA$ZGln____$argon2id$v=19$m=1024,t=1,p=1$c2FsdA$ZGln";
        MockHttpServletResponse response = new MockHttpServletResponse();

        developmentDeployer.deploy(response, derived);

        String value = response.getCookie(AuthCookieDeployer.COOKIE_NAME).getValue();
        assertThat(value).doesNotContain(",", "$", "=");
        assertThat(URLDecoder.decode(value, StandardCharsets.UTF_8)).isEqualTo(derived);
    }

    @Test
    @DisplayName("clear expires the cookie with the same attributes")
    void clearCookie() {
        MockHttpServletResponse response = new MockHttpServletResponse();

        productionDeployer.clear(response);

        MockCookie cookie = (MockCookie) response.getCookie(AuthCookieDeployer.COOKIE_NAME);
        assertThat(cookie.getValue()).isEmpty();
        assertThat(cookie.getMaxAge()).isZero();
        assertThat(cookie.getPath()).isEqualTo("/");
        assertThat(cookie.getSecure()).isTrue();
        assertThat(cookie.getSameSite()).isEqualTo("Lax");
    }

    @Test
    @DisplayName("a missing or committed response is a wiring defect")
    void unavailableResponse() {
        assertThatThrownBy(() -> developmentDeployer.deploy(null, "abc"))
                .isInstanceOf(IllegalStateException.class);

        MockHttpServletResponse committed = new MockHttpServletResponse();
        committed.setCommitted(true);
        assertThatThrownBy(() -> developmentDeployer.deploy(committed, "abc"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("an empty cookie value is rejected")
    void emptyValue() {
        assertThatThrownBy(() -> developmentDeployer.deploy(new MockHttpServletResponse(), ""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
