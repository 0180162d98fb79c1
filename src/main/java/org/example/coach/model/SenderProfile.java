package org.example.coach.model;

/**
 * Identity fields the messaging platform sends along with an event. Any field may be null.
 */
public record SenderProfile(
        String username,
        String firstName,
        String lastName
) {
    public static final SenderProfile EMPTY = new SenderProfile(null, null, null);
}
