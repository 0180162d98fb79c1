package org.example.coach.service.conversation;

import org.example.coach.model.SenderProfile;

/**
 * An event from the messaging platform, classified once at the boundary.
 */
public sealed interface InboundEvent permits InboundEvent.ButtonPress, InboundEvent.TextMessage {

    long userId();

    SenderProfile sender();

    record ButtonPress(long userId, String data, SenderProfile sender) implements InboundEvent {
        public ButtonPress {
            sender = sender == null ? SenderProfile.EMPTY : sender;
        }
    }

    record TextMessage(long userId, String body, SenderProfile sender) implements InboundEvent {
        public TextMessage {
            sender = sender == null ? SenderProfile.EMPTY : sender;
        }
    }
}
