package com.streamsync.watchparty.websocket.socketio.handler;

import static com.streamsync.watchparty.websocket.socketio.SocketIOEvents.*;

import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.annotation.OnEvent;
import com.streamsync.watchparty.dto.ChangeVideoRequest;
import com.streamsync.watchparty.dto.PositionRequest;
import com.streamsync.watchparty.session.RoomCoordinationService;
import com.streamsync.watchparty.websocket.socketio.SocketCallers;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 재생 제어 핸들러
 * 영상 변경, 재생/일시정지/탐색, 위치 보고(하트비트), 동기화 요청
 */
@Component
@ConditionalOnProperty(name = "socketio.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class PlaybackHandler {

    private final RoomCoordinationService coordinationService;

    @OnEvent(CHANGE_VIDEO)
    public void handleChangeVideo(SocketIOClient client, ChangeVideoRequest request) {
        SocketCallers.resolve(client).ifPresent(caller -> coordinationService.changeVideo(caller, request));
    }

    @OnEvent(PLAY_VIDEO)
    public void handlePlay(SocketIOClient client, String roomId) {
        SocketCallers.resolve(client).ifPresent(caller -> coordinationService.playVideo(caller, roomId));
    }

    @OnEvent(PAUSE_VIDEO)
    public void handlePause(SocketIOClient client, String roomId) {
        SocketCallers.resolve(client).ifPresent(caller -> coordinationService.pauseVideo(caller, roomId));
    }

    @OnEvent(SEEK_VIDEO)
    public void handleSeek(SocketIOClient client, PositionRequest request) {
        SocketCallers.resolve(client).ifPresent(caller -> coordinationService.seekVideo(caller, request));
    }

    @OnEvent(REPORT_POSITION)
    public void handleReportPosition(SocketIOClient client, PositionRequest request) {
        SocketCallers.resolve(client).ifPresent(caller -> coordinationService.reportPosition(caller, request));
    }

    @OnEvent(REQUEST_SYNC)
    public void handleRequestSync(SocketIOClient client, String roomId) {
        SocketCallers.resolve(client).ifPresent(caller -> coordinationService.requestSync(caller, roomId));
    }
}
