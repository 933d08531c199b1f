package com.firefly.kbagent.security;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Date;
import javax.crypto.SecretKey;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtAuthenticationFilterTest {

    private static final String SECRET = "ZmlyZWZseS1rYi1hZ2VudC1nYXRld2F5LXRlc3Qtc2lnbmluZy1rZXktMzJieXRlcw==";

    private JwtAuthenticationFilter filter;
    private SecretKey key;

    @BeforeEach
    void setUp() {
        JwtProperties properties = new JwtProperties();
        properties.setSecret(SECRET);
        filter = new JwtAuthenticationFilter(properties);
        key = Keys.hmacShaKeyFor(Decoders.BASE64.decode(SECRET));
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void validTokenPopulatesPrincipal() throws Exception {
        String token = Jwts.builder()
                .subject("user-1")
                .claim("email", "alice@example.com")
                .expiration(new Date(System.currentTimeMillis() + 60_000))
                .signWith(key)
                .compact();

        Authentication authentication = filter(token);

        assertThat(authentication).isNotNull();
        CustomUserPrincipal principal = (CustomUserPrincipal) authentication.getPrincipal();
        assertThat(principal.getUserId()).isEqualTo("user-1");
        assertThat(principal.getEmail()).isEqualTo("alice@example.com");
    }

    @Test
    void tokenWithoutSubjectStillAuthenticates() throws Exception {
        String token = Jwts.builder().claim("email", "alice@example.com").signWith(key).compact();

        Authentication authentication = filter(token);

        assertThat(((CustomUserPrincipal) authentication.getPrincipal()).getUserId()).isNull();
    }

    @Test
    void expiredOrForeignTokensAreIgnored() throws Exception {
        String expired = Jwts.builder()
                .subject("user-1")
                .expiration(new Date(System.currentTimeMillis() - 60_000))
                .signWith(key)
                .compact();
        SecretKey otherKey = Keys.hmacShaKeyFor("another-secret-key-that-is-long-enough!!".getBytes());
        String foreign = Jwts.builder().subject("user-1").signWith(otherKey).compact();

        assertThat(filter(expired)).isNull();
        assertThat(filter(foreign)).isNull();
        assertThat(filter("not-a-jwt")).isNull();
    }

    @Test
    void missingSecretFailsFast() {
        assertThatThrownBy(() -> new JwtAuthenticationFilter(new JwtProperties()))
                .isInstanceOf(IllegalStateException.class);
    }

    private Authentication filter(String token) throws Exception {
        SecurityContextHolder.clearContext();
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/chat");
        request.addHeader("Authorization", "Bearer " + token);
        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());
        return SecurityContextHolder.getContext().getAuthentication();
    }
}
