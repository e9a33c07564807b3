package com.streamsync.watchparty.service;

import com.streamsync.watchparty.websocket.socketio.SocketUser;
import lombok.RequiredArgsConstructor;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Service;

/**
 * 액세스 토큰에서 사용자 정보를 꺼낸다.
 * subject 가 사용자 id, name/avatarUrl 클레임이 표시 이름과 아바타다.
 */
@Service
@RequiredArgsConstructor
public class JwtService {

    static final String NAME_CLAIM = "name";
    static final String AVATAR_CLAIM = "avatarUrl";

    private final JwtDecoder jwtDecoder;

    /**
     * @throws JwtException 서명/만료 검증 실패 또는 subject 가 없는 토큰
     */
    public SocketUser extractUser(String token, String socketId) {
        Jwt jwt = jwtDecoder.decode(token);
        String userId = jwt.getSubject();
        if (userId == null || userId.isBlank()) {
            throw new JwtException("Token has no subject");
        }
        return new SocketUser(
                userId,
                jwt.getClaimAsString(NAME_CLAIM),
                jwt.getClaimAsString(AVATAR_CLAIM),
                socketId
        );
    }
}
