package org.example.coach.service.conversation;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Button actions. The code is the first segment of the callback payload.
 */
public enum ActionId {
    SET_LANGUAGE("set_lang"),
    MAIN_MENU("main_menu"),
    BACK("back"),
    QUIZ_MENU("quiz"),
    QUIZ_LEVEL("quiz_level"),
    QUIZ_LOCKED("quiz_locked"),
    QUIZ_ANSWER("quiz_ans"),
    QUIZ_BACK_LEVELS("quiz_back_levels"),
    QUIZ_HOME("quiz_home"),
    SCENARIO_MENU("scenarios"),
    SCENARIO_START("scenario_start"),
    SCENARIO_CHOOSE("scenario_choose"),
    SCENARIO_RETRY("scenario_retry"),
    SCENARIO_HOME("scenario_home"),
    BALANCE("balance"),
    SHOP("shop"),
    BUY_HINT("buy_hint"),
    LEVEL_INFO("level_info"),
    LEADERBOARD("leaderboard"),
    REFERRAL("referral"),
    HELP("help");

    private static final Map<String, ActionId> BY_CODE = new HashMap<>();

    static {
        for (ActionId id : values()) {
            BY_CODE.put(id.code, id);
        }
    }

    private final String code;

    ActionId(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<ActionId> fromCode(String code) {
        return Optional.ofNullable(BY_CODE.get(code));
    }
}
