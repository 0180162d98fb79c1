package org.example.coach.service.conversation;

import java.util.List;

/**
 * What to show the user after one event.
 * <p>
 * When {@code editCurrent} is set the first view replaces the message the user pressed a
 * button on; remaining views are sent as new messages. {@code notice} is a short ephemeral line.
 */
public record ConversationReply(
        long userId,
        boolean editCurrent,
        List<OutboundView> views,
        String notice,
        ConversationFailure failure
) {
    public ConversationReply {
        views = views == null ? List.of() : List.copyOf(views);
    }

    public static ConversationReply show(long userId, boolean editCurrent, OutboundView view) {
        return new ConversationReply(userId, editCurrent, List.of(view), null, null);
    }

    public static ConversationReply noticeOnly(long userId, String notice) {
        return new ConversationReply(userId, false, List.of(), notice, null);
    }

    public static ConversationReply failed(long userId, ConversationFailure failure) {
        return new ConversationReply(userId, false, List.of(), failure.userMessage(), failure);
    }

    public ConversationReply withNotice(String value) {
        return new ConversationReply(userId, editCurrent, views, value, failure);
    }
}
