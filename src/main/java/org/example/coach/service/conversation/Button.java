package org.example.coach.service.conversation;

public record Button(String label, String data) {

    public static Button of(String label, ActionId action, Object... args) {
        return new Button(label, ActionCodec.encode(action, args));
    }
}
