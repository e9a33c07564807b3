package com.streamsync.watchparty.websocket.socketio;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.corundumstudio.socketio.AuthTokenResult;
import com.corundumstudio.socketio.SocketIOClient;
import com.streamsync.watchparty.service.JwtService;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.oauth2.jwt.BadJwtException;

@ExtendWith(MockitoExtension.class)
class AuthTokenListenerImplTest {

    private static final UUID SESSION_ID = UUID.fromString("7b0c3c1e-4a7e-4d8f-9a44-0d6f2c1b5e10");

    @Mock
    private JwtService jwtService;

    @Mock
    private SocketIOClient client;

    private AuthTokenListenerImpl listener;

    @BeforeEach
    void setUp() {
        listener = new AuthTokenListenerImpl(jwtService);
    }

    @Test
    void validTokenStoresUserOnClient() {
        SocketUser user = new SocketUser("user-1", "Alice", null, SESSION_ID.toString());
        when(client.getSessionId()).thenReturn(SESSION_ID);
        when(jwtService.extractUser("good-token", SESSION_ID.toString())).thenReturn(user);

        AuthTokenResult result = listener.getAuthTokenResult(Map.of("token", "good-token"), client);

        assertThat(result.isSuccess()).isTrue();
        verify(client).set(SocketIOEvents.USER_ATTRIBUTE, user);
    }

    @Test
    void invalidTokenIsRejected() {
        when(client.getSessionId()).thenReturn(SESSION_ID);
        when(jwtService.extractUser(eq("bad-token"), anyString())).thenThrow(new BadJwtException("bad signature"));

        AuthTokenResult result = listener.getAuthTokenResult(Map.of("token", "bad-token"), client);

        assertThat(result.isSuccess()).isFalse();
        verify(client, never()).set(anyString(), any());
    }

    @Test
    void missingTokenIsRejected() {
        assertThat(listener.getAuthTokenResult(Map.of(), client).isSuccess()).isFalse();
        assertThat(listener.getAuthTokenResult(null, client).isSuccess()).isFalse();

        verifyNoInteractions(jwtService);
    }
}
