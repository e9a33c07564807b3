package com.streamsync.watchparty.config;

import com.corundumstudio.socketio.SocketIOServer;
import com.streamsync.watchparty.websocket.socketio.handler.ChatMessageHandler;
import com.streamsync.watchparty.websocket.socketio.handler.ConnectionHandler;
import com.streamsync.watchparty.websocket.socketio.handler.PlaybackHandler;
import com.streamsync.watchparty.websocket.socketio.handler.RoomControlHandler;
import com.streamsync.watchparty.websocket.socketio.handler.RoomJoinHandler;
import com.streamsync.watchparty.websocket.socketio.handler.RoomLeaveHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Socket.IO 이벤트 핸들러 등록자.
 *
 * SpringAnnotationScanner 를 쓰면 핸들러 Bean 생성 중에 SocketIOServer 를 다시 요청해 순환 참조가 생긴다.
 * 모든 Bean 이 준비된 ApplicationReadyEvent 시점에 핸들러를 등록하고 서버를 시작한다.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "socketio.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class SocketIOEventRegistrar {

    private final SocketIOServer socketIOServer;

    private final ConnectionHandler connectionHandler;
    private final RoomJoinHandler roomJoinHandler;
    private final RoomLeaveHandler roomLeaveHandler;
    private final ChatMessageHandler chatMessageHandler;
    private final PlaybackHandler playbackHandler;
    private final RoomControlHandler roomControlHandler;

    @EventListener(ApplicationReadyEvent.class)
    public void registerEventHandlers() {
        log.info("Socket.IO 이벤트 핸들러 등록 시작...");

        socketIOServer.addListeners(connectionHandler);
        socketIOServer.addListeners(roomJoinHandler);
        socketIOServer.addListeners(roomLeaveHandler);
        socketIOServer.addListeners(chatMessageHandler);
        socketIOServer.addListeners(playbackHandler);
        socketIOServer.addListeners(roomControlHandler);

        log.info("Socket.IO 이벤트 핸들러 등록 완료 - 총 6개 핸들러");

        // 핸들러 등록 완료 후 서버 시작
        socketIOServer.start();
        log.info("Socket.IO 서버 시작 완료 - port: {}", socketIOServer.getConfiguration().getPort());
    }
}
