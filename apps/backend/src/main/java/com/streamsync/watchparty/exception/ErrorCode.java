package com.streamsync.watchparty.exception;

/**
 * 방 액션 실패 코드. 클라이언트에는 error 이벤트의 code 로 전달된다.
 */
public enum ErrorCode {
    ROOM_NOT_FOUND("ROOM_NOT_FOUND", "방을 찾을 수 없거나 이미 종료된 방입니다."),
    PARTICIPANT_NOT_FOUND("PARTICIPANT_NOT_FOUND", "방에 참가 중인 사용자가 아닙니다."),
    PERMISSION_DENIED("PERMISSION_DENIED", "권한이 없습니다."),
    VALIDATION_FAILED("VALIDATION_FAILED", "잘못된 요청입니다."),
    COLLABORATOR_FAILURE("COLLABORATOR_FAILURE", "방 정보를 갱신하지 못했습니다."),
    ROOM_BUSY("ROOM_BUSY", "요청이 많아 처리하지 못했습니다. 잠시 후 다시 시도해주세요."),
    UNAUTHORIZED("UNAUTHORIZED", "인증이 필요합니다."),
    INTERNAL_ERROR("INTERNAL_ERROR", "요청 처리 중 오류가 발생했습니다.");

    private final String code;
    private final String message;

    ErrorCode(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
