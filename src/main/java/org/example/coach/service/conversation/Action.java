package org.example.coach.service.conversation;

import java.util.List;
import java.util.OptionalInt;

public record Action(ActionId id, List<String> args) {

    public Action {
        args = args == null ? List.of() : List.copyOf(args);
    }

    public String arg(int index) {
        return index < args.size() ? args.get(index) : null;
    }

    public OptionalInt intArg(int index) {
        String value = arg(index);
        if (value == null) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(value));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }
}
