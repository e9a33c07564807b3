package com.streamsync.watchparty.state.control;

import com.streamsync.watchparty.model.Participant;
import java.util.Optional;

/**
 * 참가자 제거 결과.
 *
 * @param participant   제거된 참가자
 * @param newController 제거로 인해 바뀐 제어권자. 바뀌지 않았으면 null.
 * @param remaining     남은 참가자 수
 */
public record Departure(Participant participant, Participant newController, int remaining) {

    public Optional<Participant> successor() {
        return Optional.ofNullable(newController);
    }

    public boolean roomEmptied() {
        return remaining == 0;
    }
}
