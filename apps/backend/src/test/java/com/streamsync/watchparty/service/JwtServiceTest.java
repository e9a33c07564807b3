package com.streamsync.watchparty.service;

import static org.assertj.core.api.Assertions.*;

import com.nimbusds.jose.jwk.source.ImmutableSecret;
import com.streamsync.watchparty.config.SecurityConfig;
import com.streamsync.watchparty.websocket.socketio.SocketUser;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

class JwtServiceTest {

    private static final String SECRET = "test-secret-key-that-is-at-least-32-bytes";

    private JwtService jwtService;
    private JwtEncoder encoder;

    @BeforeEach
    void setUp() {
        jwtService = new JwtService(new SecurityConfig().jwtDecoder(SECRET));
        encoder = encoderFor(SECRET);
    }

    private static JwtEncoder encoderFor(String secret) {
        SecretKey key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        return new NimbusJwtEncoder(new ImmutableSecret<>(key));
    }

    private static String token(JwtEncoder encoder, JwtClaimsSet claims) {
        JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
        return encoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
    }

    @Test
    void extractsUserFromValidToken() {
        Instant now = Instant.now();
        JwtClaimsSet claims = JwtClaimsSet.builder()
                .subject("user-1")
                .claim("name", "Alice")
                .claim("avatarUrl", "https://cdn.example.com/alice.png")
                .issuedAt(now)
                .expiresAt(now.plus(1, ChronoUnit.HOURS))
                .build();

        SocketUser user = jwtService.extractUser(token(encoder, claims), "socket-1");

        assertThat(user.id()).isEqualTo("user-1");
        assertThat(user.name()).isEqualTo("Alice");
        assertThat(user.avatarUrl()).isEqualTo("https://cdn.example.com/alice.png");
        assertThat(user.socketId()).isEqualTo("socket-1");
    }

    @Test
    void expiredTokenIsRejected() {
        Instant past = Instant.now().minus(2, ChronoUnit.HOURS);
        JwtClaimsSet claims = JwtClaimsSet.builder()
                .subject("user-1")
                .issuedAt(past)
                .expiresAt(past.plus(30, ChronoUnit.MINUTES))
                .build();

        String expired = token(encoder, claims);

        assertThatThrownBy(() -> jwtService.extractUser(expired, "socket-1"))
                .isInstanceOf(JwtException.class);
    }

    @Test
    void tokenSignedWithOtherKeyIsRejected() {
        Instant now = Instant.now();
        JwtClaimsSet claims = JwtClaimsSet.builder()
                .subject("user-1")
                .issuedAt(now)
                .expiresAt(now.plus(1, ChronoUnit.HOURS))
                .build();

        String forged = token(encoderFor("another-secret-key-that-is-32-bytes-long"), claims);

        assertThatThrownBy(() -> jwtService.extractUser(forged, "socket-1"))
                .isInstanceOf(JwtException.class);
    }

    @Test
    void tokenWithoutSubjectIsRejected() {
        Instant now = Instant.now();
        JwtClaimsSet claims = JwtClaimsSet.builder()
                .claim("name", "Nobody")
                .issuedAt(now)
                .expiresAt(now.plus(1, ChronoUnit.HOURS))
                .build();

        String anonymous = token(encoder, claims);

        assertThatThrownBy(() -> jwtService.extractUser(anonymous, "socket-1"))
                .isInstanceOf(JwtException.class)
                .hasMessageContaining("subject");
    }

    @Test
    void malformedTokenIsRejected() {
        assertThatThrownBy(() -> jwtService.extractUser("not-a-jwt", "socket-1"))
                .isInstanceOf(JwtException.class);
    }
}
