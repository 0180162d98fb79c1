package org.example.coach.service.conversation;

import java.util.List;

/**
 * Text plus an inline keyboard, one row per inner list.
 */
public record OutboundView(
        ViewId view,
        String text,
        List<List<Button>> keyboard
) {
    public OutboundView {
        keyboard = keyboard == null
                ? List.of()
                : keyboard.stream().map(List::copyOf).toList();
    }

    public static OutboundView notice(String text) {
        return new OutboundView(ViewId.NOTICE, text, List.of());
    }
}
