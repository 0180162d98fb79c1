package org.example.coach.service.conversation;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Callback payload format: {@code code|arg1|arg2...}.
 */
public final class ActionCodec {

    static final String SEPARATOR = "|";

    private ActionCodec() {
    }

    public static String encode(ActionId id, Object... args) {
        return Stream.concat(Stream.of(id.code()), Arrays.stream(args).map(String::valueOf))
                .collect(Collectors.joining(SEPARATOR));
    }

    public static Optional<Action> decode(String data) {
        if (data == null || data.isBlank()) {
            return Optional.empty();
        }
        String[] parts = data.trim().split("\\|", -1);
        return ActionId.fromCode(parts[0])
                .map(id -> new Action(id, List.of(parts).subList(1, parts.length)));
    }
}
