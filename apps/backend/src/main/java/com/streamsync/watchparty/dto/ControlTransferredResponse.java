package com.streamsync.watchparty.dto;

import com.streamsync.watchparty.model.Participant;

public record ControlTransferredResponse(String newControllerId, String newControllerName) {

    public static ControlTransferredResponse from(Participant controller) {
        return new ControlTransferredResponse(controller.id(), controller.displayName());
    }
}
