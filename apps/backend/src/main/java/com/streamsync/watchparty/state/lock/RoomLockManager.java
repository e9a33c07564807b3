package com.streamsync.watchparty.state.lock;

import java.util.function.Supplier;

/**
 * 방 단위 상호 배제.
 *
 * 같은 방에 대한 변경과 그에 따른 알림 발송은 이 락 안에서 순서대로 일어난다.
 * 서로 다른 방은 서로를 막지 않는다. 같은 스레드에서 다시 잡을 수 있다(재진입).
 *
 * 대기 시간 안에 락을 얻지 못하면 ErrorCode.ROOM_BUSY 로 RoomActionException 을 던진다.
 */
public interface RoomLockManager {

    <T> T withRoomLock(String roomId, Supplier<T> action);

    default void runWithRoomLock(String roomId, Runnable action) {
        withRoomLock(roomId, () -> {
            action.run();
            return null;
        });
    }
}
