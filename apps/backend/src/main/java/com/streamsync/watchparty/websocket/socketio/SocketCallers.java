package com.streamsync.watchparty.websocket.socketio;

import com.corundumstudio.socketio.SocketIOClient;
import com.streamsync.watchparty.dto.ErrorResponse;
import com.streamsync.watchparty.exception.ErrorCode;
import com.streamsync.watchparty.session.RoomCaller;
import java.util.Optional;

/**
 * SocketIOClient → RoomCaller 변환.
 */
public final class SocketCallers {

    private SocketCallers() {
    }

    /**
     * 인증되지 않은 연결이면 error 이벤트를 보내고 empty 를 반환한다.
     */
    public static Optional<RoomCaller> resolve(SocketIOClient client) {
        SocketUser user = client.get(SocketIOEvents.USER_ATTRIBUTE);
        if (user == null) {
            client.sendEvent(SocketIOEvents.ERROR,
                    new ErrorResponse(ErrorCode.UNAUTHORIZED.getCode(), ErrorCode.UNAUTHORIZED.getMessage()));
            return Optional.empty();
        }
        return Optional.of(new RoomCaller(
                client.getSessionId().toString(),
                user.id(),
                user.name(),
                user.avatarUrl()
        ));
    }
}
