package org.example.coach.service.conversation;

public enum ViewId {
    LANGUAGE_SELECT,
    MAIN_MENU,
    QUIZ_LEVELS,
    QUIZ_QUESTION,
    QUIZ_RESULT,
    SCENARIO_MENU,
    SCENARIO_PLAY,
    SCENARIO_RESULT,
    BALANCE,
    SHOP,
    LEADERBOARD,
    REFERRAL,
    HELP,
    NOTICE
}
