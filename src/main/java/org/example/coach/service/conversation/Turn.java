package org.example.coach.service.conversation;

import org.example.coach.model.SenderProfile;

/**
 * Context for handling one inbound event while the session lock is held.
 */
public record Turn(
        long userId,
        SessionState session,
        SenderProfile sender,
        boolean editCurrent
) {

    public String language() {
        return session.getLanguage();
    }

    public NavigationStack navigation() {
        return session.getNavigation();
    }

    public ConversationReply show(OutboundView view) {
        return ConversationReply.show(userId, editCurrent, view);
    }

    public ConversationReply notice(String text) {
        return ConversationReply.noticeOnly(userId, text);
    }

    public ConversationReply invalid() {
        return ConversationReply.failed(userId, ConversationFailure.INVALID_SELECTION);
    }
}
