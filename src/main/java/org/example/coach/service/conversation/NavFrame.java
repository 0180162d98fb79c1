package org.example.coach.service.conversation;

/**
 * One entry of a user's view history. {@code argument} carries view parameters such as a leaderboard period.
 */
public record NavFrame(ViewId view, String argument) {

    public static final NavFrame ROOT = new NavFrame(ViewId.MAIN_MENU, null);

    public static NavFrame of(ViewId view) {
        return new NavFrame(view, null);
    }
}
