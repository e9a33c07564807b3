package com.streamsync.watchparty.websocket.socketio;

/**
 * Socket.IO 이벤트 이름.
 */
public final class SocketIOEvents {

    public static final String USER_ATTRIBUTE = "user";

    // Client → Server
    public static final String JOIN_ROOM = "joinRoom";
    public static final String LEAVE_ROOM = "leaveRoom";
    public static final String SEND_MESSAGE = "sendMessage";
    public static final String CHANGE_VIDEO = "changeVideo";
    public static final String PLAY_VIDEO = "playVideo";
    public static final String PAUSE_VIDEO = "pauseVideo";
    public static final String SEEK_VIDEO = "seekVideo";
    public static final String REPORT_POSITION = "reportPosition";
    public static final String REQUEST_SYNC = "requestSync";
    public static final String TRANSFER_CONTROL = "transferControl";
    public static final String KICK_USER = "kickUser";
    public static final String UPDATE_SYNC_MODE = "updateSyncMode";
    public static final String REQUEST_ROOM_PARTICIPANTS = "requestRoomParticipants";
    public static final String CLOSE_ROOM = "closeRoom";

    // Server → Client
    public static final String ROOM_JOINED = "roomJoined";
    public static final String ROOM_LEFT = "roomLeft";
    public static final String PARTICIPANT_JOINED_NOTICE = "participantJoinedNotice";
    public static final String PARTICIPANT_LEFT_NOTICE = "participantLeftNotice";
    public static final String RECEIVE_ROOM_PARTICIPANTS = "receiveRoomParticipants";
    public static final String RECEIVE_CHAT_HISTORY = "receiveChatHistory";
    public static final String RECEIVE_MESSAGE = "receiveMessage";
    public static final String CONTROL_TRANSFERRED = "controlTransferred";
    public static final String RECEIVE_PLAYBACK_UPDATE = "receivePlaybackUpdate";
    public static final String FORCE_SYNC_PLAYBACK = "forceSyncPlayback";
    public static final String RECEIVE_HEARTBEAT = "receiveHeartbeat";
    public static final String VIDEO_CHANGED = "videoChanged";
    public static final String USER_KICKED = "userKicked";
    public static final String ROOM_CLOSED = "roomClosed";
    public static final String SYNC_MODE_CHANGED = "syncModeChanged";
    public static final String ERROR = "error";

    private SocketIOEvents() {
    }
}
