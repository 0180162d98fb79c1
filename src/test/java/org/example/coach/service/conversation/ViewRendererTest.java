package org.example.coach.service.conversation;

import org.example.coach.model.LeaderboardPosition;
import org.example.coach.model.LeaderboardRow;
import org.example.coach.model.LeaderboardSnapshot;
import org.example.coach.service.content.QuizQuestion;
import org.example.coach.service.quiz.QuizSession;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ViewRendererTest {

    private final ViewRenderer renderer = new ViewRenderer();

    @Test
    void progressBar_clampsAndRounds() {
        assertEquals("0% [..........]", ViewRenderer.progressBar(-0.3));
        assertEquals("50% [=====.....]", ViewRenderer.progressBar(0.5));
        assertEquals("100% [==========]", ViewRenderer.progressBar(1.7));
    }

    @Test
    void quizLevels_lockedLevelsUseLockedAction() {
        OutboundView view = renderer.quizLevels(2, 3);

        assertEquals(ViewId.QUIZ_LEVELS, view.view());
        assertEquals("quiz_level|1", view.keyboard().get(0).get(0).data());
        assertEquals("quiz_level|2", view.keyboard().get(1).get(0).data());
        assertEquals("quiz_locked|3", view.keyboard().get(2).get(0).data());
        assertEquals("back", view.keyboard().get(view.keyboard().size() - 1).get(0).data());
    }

    @Test
    void quizQuestion_answerButtonsCarryLevelAndQuestion() {
        QuizQuestion question = new QuizQuestion("A caller asks for your SMS code.", List.of("Tell them", "Hang up"), 1);

        OutboundView view = renderer.quizQuestion(new QuizSession(2, 1, 1, 3), question, null);

        assertTrue(view.text().contains("Level 2 · Question 2/3"));
        assertEquals("quiz_ans|2|1|0", view.keyboard().get(0).get(0).data());
        assertEquals("quiz_ans|2|1|1", view.keyboard().get(1).get(0).data());
    }

    @Test
    void leaderboard_offersOtherPeriodsAndRequesterPosition() {
        LeaderboardSnapshot snapshot = new LeaderboardSnapshot("weekly",
                List.of(new LeaderboardRow(1, 7L, "@alice", 42)), 5, new LeaderboardPosition(4, 3, 40.0));

        OutboundView view = renderer.leaderboard(snapshot);

        assertTrue(view.text().contains("🥇 @alice · 42"));
        assertTrue(view.text().contains("Your position: #4 · percentile 40.0%"));
        List<Button> periods = view.keyboard().get(0);
        assertEquals(2, periods.size());
        assertTrue(periods.stream().noneMatch(button -> button.data().equals("leaderboard|weekly")));
    }

    @Test
    void leaderboard_empty_invitesFirstPlayer() {
        OutboundView view = renderer.leaderboard(new LeaderboardSnapshot("all_time", List.of(), 0, null));

        assertTrue(view.text().contains("No players yet"));
        assertFalse(view.text().contains("Your position"));
    }
}
