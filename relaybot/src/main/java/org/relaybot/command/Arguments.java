package org.relaybot.command;

import java.util.List;
import java.util.Optional;

/**
 * Raw arguments of an invocation, already split by the caller.
 */
public record Arguments(List<String> raw) {

    public Arguments {
        raw = raw == null ? List.of() : List.copyOf(raw);
    }

    public static Arguments of(String... args) {
        return new Arguments(List.of(args));
    }

    public static Arguments empty() {
        return new Arguments(List.of());
    }

    public String get(int index) {
        if (index < 0 || index >= raw.size()) {
            throw new IndexOutOfBoundsException("Missing argument #" + index + " (" + raw.size() + " given)");
        }
        return raw.get(index);
    }

    public Optional<String> optional(int index) {
        return index >= 0 && index < raw.size() ? Optional.of(raw.get(index)) : Optional.empty();
    }

    public String join() {
        return String.join(" ", raw);
    }

    public int size() {
        return raw.size();
    }

    public boolean isEmpty() {
        return raw.isEmpty();
    }
}
