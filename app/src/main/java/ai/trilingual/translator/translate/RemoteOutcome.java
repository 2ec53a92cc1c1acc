package ai.trilingual.translator.translate;

import java.util.List;
import java.util.Objects;

/**
 * Explicit success or failure value of one remote call, so a failing unit never short-circuits its neighbours.
 */
record RemoteOutcome(List<String> lines, String failure) {

    RemoteOutcome {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    static RemoteOutcome success(List<String> lines) {
        return new RemoteOutcome(Objects.requireNonNull(lines, "lines"), null);
    }

    static RemoteOutcome failure(String reason) {
        return new RemoteOutcome(List.of(), reason == null ? "unknown failure" : reason);
    }

    boolean isSuccess() {
        return failure == null;
    }
}
