package org.example.coach.entity;

public enum UserEventType {
    USER_SIGNUP("user_signup"),
    USER_RETURN("user_return"),
    QUIZ_START("quiz_start"),
    QUIZ_LEVEL_START("quiz_level_start"),
    QUIZ_COMPLETE("quiz_complete"),
    SCENARIO_START("scenario_start"),
    SCENARIO_COMPLETE("scenario_complete"),
    REFERRAL_SIGNUP("referral_signup"),
    HINT_PURCHASE("hint_purchase");

    private final String code;

    UserEventType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
