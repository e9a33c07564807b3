package com.streamsync.watchparty.websocket.socketio;

import com.corundumstudio.socketio.AuthTokenListener;
import com.corundumstudio.socketio.AuthTokenResult;
import com.corundumstudio.socketio.SocketIOClient;
import com.streamsync.watchparty.service.JwtService;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Component;

/**
 * Socket.IO Authorization Handler
 * socket.handshake.auth.token 을 검증하고 SocketUser 를 client 에 저장한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "socketio.enabled", havingValue = "true", matchIfMissing = true)
public class AuthTokenListenerImpl implements AuthTokenListener {

    private final JwtService jwtService;

    @Override
    public AuthTokenResult getAuthTokenResult(Object authPayload, SocketIOClient client) {
        if (!(authPayload instanceof Map<?, ?> raw)) {
            return new AuthTokenResult(false, Map.of("message", "Missing auth payload"));
        }

        if (!(raw.get("token") instanceof String token) || token.isBlank()) {
            return new AuthTokenResult(false, Map.of("message", "Missing token"));
        }

        String socketId = client.getSessionId().toString();
        try {
            client.set(SocketIOEvents.USER_ATTRIBUTE, jwtService.extractUser(token, socketId));
        } catch (JwtException e) {
            log.debug("Socket handshake rejected - socketId: {}, reason: {}", socketId, e.getMessage());
            return new AuthTokenResult(false, Map.of("message", "Invalid token"));
        }
        return AuthTokenResult.AuthTokenResultSuccess;
    }
}
