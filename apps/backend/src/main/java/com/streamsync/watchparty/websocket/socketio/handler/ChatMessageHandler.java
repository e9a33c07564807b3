package com.streamsync.watchparty.websocket.socketio.handler;

import static com.streamsync.watchparty.websocket.socketio.SocketIOEvents.SEND_MESSAGE;

import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.annotation.OnEvent;
import com.streamsync.watchparty.dto.ChatMessageRequest;
import com.streamsync.watchparty.session.RoomCoordinationService;
import com.streamsync.watchparty.websocket.socketio.SocketCallers;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "socketio.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class ChatMessageHandler {

    private final RoomCoordinationService coordinationService;

    @OnEvent(SEND_MESSAGE)
    public void handleChatMessage(SocketIOClient client, ChatMessageRequest request) {
        SocketCallers.resolve(client).ifPresent(caller -> coordinationService.sendMessage(caller, request));
    }
}
