package com.enterprise.approval.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Base64;
import java.util.Date;
import java.util.List;

import javax.crypto.SecretKey;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.enterprise.approval.model.Actor;
import com.enterprise.approval.model.enums.Role;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;

class JwtTokenProviderTest {

    private static final String SECRET =
            "5b2nWxrng8o3sT/lAPA0yO8OaDFHDaxYtPAIk9RfqtUCknwYKyQHqArz1rIRrzf2mVYebaQWkmqzRVbD24LmuQ==";

    private JwtProperties properties;
    private JwtTokenProvider provider;

    @BeforeEach
    void setUp() {
        properties = new JwtProperties();
        properties.setSecretKey(SECRET);
        provider = new JwtTokenProvider(properties);
    }

    @Test
    void tokenRoundTripsIntoActorWithHighestRole() {
        String token = provider.generateToken("mgr-1", "mgr@corp.test", List.of("employee", "MANAGER"));

        assertThat(provider.validateToken(token)).isTrue();
        Actor actor = provider.getPrincipalFromToken(token).toActor();
        assertThat(actor).isEqualTo(new Actor("mgr-1", "mgr@corp.test", Role.MANAGER));
    }

    @Test
    void singleRoleClaimIsAccepted() {
        SecretKey key = Keys.hmacShaKeyFor(Base64.getDecoder().decode(SECRET));
        String token = Jwts.builder()
                .subject("adm-1")
                .issuer(properties.getIssuer())
                .expiration(new Date(System.currentTimeMillis() + 60_000))
                .claim("role", "ADMIN")
                .signWith(key, Jwts.SIG.HS512)
                .compact();

        assertThat(provider.getPrincipalFromToken(token).toActor().role()).isEqualTo(Role.ADMIN);
    }

    @Test
    void tamperedOrExpiredTokensAreInvalid() {
        String token = provider.generateToken("emp-1", "emp@corp.test", List.of("EMPLOYEE"));
        properties.setExpirationMs(-1000);
        String expired = provider.generateToken("emp-1", "emp@corp.test", List.of("EMPLOYEE"));

        assertThat(provider.validateToken(token.substring(0, token.length() - 4) + "abcd")).isFalse();
        assertThat(provider.validateToken(expired)).isFalse();
        assertThat(provider.validateToken("not-a-token")).isFalse();
    }
}
