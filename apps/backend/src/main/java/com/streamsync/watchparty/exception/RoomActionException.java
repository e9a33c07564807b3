package com.streamsync.watchparty.exception;

/**
 * 방 액션이 거절되었을 때 던지는 예외.
 * RoomCoordinationService 경계에서 잡아서 호출자에게 error 이벤트로 보낸다.
 */
public class RoomActionException extends RuntimeException {

    private final ErrorCode errorCode;

    public RoomActionException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public RoomActionException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public RoomActionException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getCode() {
        return errorCode.getCode();
    }

    public static RoomActionException roomNotFound() {
        return new RoomActionException(ErrorCode.ROOM_NOT_FOUND);
    }

    public static RoomActionException notParticipant() {
        return new RoomActionException(ErrorCode.PARTICIPANT_NOT_FOUND);
    }

    public static RoomActionException permissionDenied(String message) {
        return new RoomActionException(ErrorCode.PERMISSION_DENIED, message);
    }

    public static RoomActionException validation(String message) {
        return new RoomActionException(ErrorCode.VALIDATION_FAILED, message);
    }
}
