package ai.trilingual.translator.session;

import java.util.Objects;
import java.util.Optional;

/**
 * Answer to a staleness check: either "no changes" or the full current state.
 */
public record PollResult(boolean changed, Optional<SessionState> state) {

    private static final PollResult UNCHANGED = new PollResult(false, Optional.empty());

    public PollResult {
        state = state == null ? Optional.empty() : state;
        if (changed && state.isEmpty()) {
            throw new IllegalArgumentException("A changed poll result must carry the session state");
        }
    }

    public static PollResult unchanged() {
        return UNCHANGED;
    }

    public static PollResult changed(SessionState state) {
        return new PollResult(true, Optional.of(Objects.requireNonNull(state, "state")));
    }
}
