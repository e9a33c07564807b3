package com.streamsync.watchparty.state.control;

import static com.streamsync.watchparty.support.InMemoryRoomState.START;
import static com.streamsync.watchparty.support.InMemoryRoomState.participant;
import static org.assertj.core.api.Assertions.*;

import com.streamsync.watchparty.exception.ErrorCode;
import com.streamsync.watchparty.exception.RoomActionException;
import com.streamsync.watchparty.model.Participant;
import com.streamsync.watchparty.state.RoomStateService;
import com.streamsync.watchparty.support.InMemoryRoomState;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ControlTransferProtocolTest {

    private static final String ROOM_ID = "room-1";

    private RoomStateService roomState;
    private ControlTransferProtocol protocol;

    @BeforeEach
    void setUp() {
        roomState = new InMemoryRoomState().service();
        protocol = new ControlTransferProtocol(roomState);
    }

    @Test
    void firstJoinerReceivesControl() {
        assertThat(protocol.admit(ROOM_ID, participant("alice", START), false))
                .map(Participant::id).contains("alice");

        assertThat(roomState.findController(ROOM_ID)).map(Participant::id).contains("alice");
    }

    @Test
    void laterJoinerDoesNotTakeControl() {
        protocol.admit(ROOM_ID, participant("alice", START), false);

        assertThat(protocol.admit(ROOM_ID, participant("bob", START.plusSeconds(1)), false)).isEmpty();

        assertThat(roomState.findController(ROOM_ID)).map(Participant::id).contains("alice");
    }

    @Test
    void adminJoiningTakesControl() {
        protocol.admit(ROOM_ID, participant("alice", START), false);

        assertThat(protocol.admit(ROOM_ID, participant("admin", START.plusSeconds(1)), true))
                .map(Participant::id).contains("admin");

        assertThat(roomState.listParticipants(ROOM_ID))
                .filteredOn(Participant::hasControl)
                .extracting(Participant::id)
                .containsExactly("admin");
    }

    @Test
    void controllerCanTransferControl() {
        protocol.admit(ROOM_ID, participant("alice", START), false);
        protocol.admit(ROOM_ID, participant("bob", START.plusSeconds(1)), false);

        Participant controller = protocol.transfer(ROOM_ID, "alice", false, "bob");

        assertThat(controller.id()).isEqualTo("bob");
        assertThat(controller.hasControl()).isTrue();
        assertThat(roomState.getParticipant(ROOM_ID, "alice")).map(Participant::hasControl).contains(false);
    }

    @Test
    void adminCanTransferWithoutHoldingControl() {
        protocol.admit(ROOM_ID, participant("alice", START), false);
        protocol.admit(ROOM_ID, participant("bob", START.plusSeconds(1)), false);

        protocol.transfer(ROOM_ID, "bob", true, "bob");

        assertThat(roomState.findController(ROOM_ID)).map(Participant::id).contains("bob");
    }

    @Test
    void nonControllerCannotTransfer() {
        protocol.admit(ROOM_ID, participant("alice", START), false);
        protocol.admit(ROOM_ID, participant("bob", START.plusSeconds(1)), false);

        assertThatThrownBy(() -> protocol.transfer(ROOM_ID, "bob", false, "bob"))
                .isInstanceOfSatisfying(RoomActionException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.PERMISSION_DENIED));
        assertThat(roomState.findController(ROOM_ID)).map(Participant::id).contains("alice");
    }

    @Test
    void transferToMissingParticipantFails() {
        protocol.admit(ROOM_ID, participant("alice", START), false);

        assertThatThrownBy(() -> protocol.transfer(ROOM_ID, "alice", false, "ghost"))
                .isInstanceOfSatisfying(RoomActionException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.PARTICIPANT_NOT_FOUND));
    }

    @Test
    void controllerDepartureHandsControlToEarliestJoiner() {
        protocol.admit(ROOM_ID, participant("alice", START), false);
        protocol.admit(ROOM_ID, participant("bob", START.plusSeconds(1)), false);
        protocol.admit(ROOM_ID, participant("carol", START.plusSeconds(2)), false);

        Departure departure = protocol.depart(ROOM_ID, "alice").orElseThrow();

        assertThat(departure.participant().id()).isEqualTo("alice");
        assertThat(departure.successor()).map(Participant::id).contains("bob");
        assertThat(departure.remaining()).isEqualTo(2);
        assertThat(roomState.findController(ROOM_ID)).map(Participant::id).contains("bob");
    }

    @Test
    void nonControllerDepartureKeepsController() {
        protocol.admit(ROOM_ID, participant("alice", START), false);
        protocol.admit(ROOM_ID, participant("bob", START.plusSeconds(1)), false);

        Departure departure = protocol.depart(ROOM_ID, "bob").orElseThrow();

        assertThat(departure.successor()).isEmpty();
        assertThat(roomState.findController(ROOM_ID)).map(Participant::id).contains("alice");
    }

    @Test
    void lastDepartureEmptiesRoom() {
        protocol.admit(ROOM_ID, participant("alice", START), false);

        Departure departure = protocol.depart(ROOM_ID, "alice").orElseThrow();

        assertThat(departure.roomEmptied()).isTrue();
        assertThat(departure.successor()).isEmpty();
    }

    @Test
    void departingUnknownParticipantIsNoOp() {
        protocol.admit(ROOM_ID, participant("alice", START), false);

        assertThat(protocol.depart(ROOM_ID, "ghost")).isEmpty();
        assertThat(roomState.countParticipants(ROOM_ID)).isEqualTo(1);
    }

    @Test
    void repairAssignsControlWhenNobodyHoldsIt() {
        roomState.addParticipant(ROOM_ID, participant("bob", START.plusSeconds(1)));
        roomState.addParticipant(ROOM_ID, participant("alice", START));

        assertThat(protocol.repair(ROOM_ID)).map(Participant::id).contains("alice");
        assertThat(protocol.repair(ROOM_ID)).isEmpty();
    }

    @Test
    void concurrentAdmitsLeaveExactlyOneController() throws Exception {
        int joiners = 8;
        ExecutorService executor = Executors.newFixedThreadPool(joiners);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < joiners; i++) {
                Participant joiner = participant("user-" + i, START.plusMillis(i));
                futures.add(executor.submit(() -> {
                    start.await();
                    return protocol.admit(ROOM_ID, joiner, false);
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(roomState.countParticipants(ROOM_ID)).isEqualTo(joiners);
        assertThat(roomState.listParticipants(ROOM_ID))
                .filteredOn(Participant::hasControl)
                .hasSize(1);
    }
}
