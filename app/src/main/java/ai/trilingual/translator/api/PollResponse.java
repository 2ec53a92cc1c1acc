package ai.trilingual.translator.api;

import ai.trilingual.translator.session.PollResult;
import ai.trilingual.translator.session.SessionState;
import java.util.Optional;

public record PollResponse(boolean changed, Optional<SessionState> state) {

    public PollResponse {
        state = state == null ? Optional.empty() : state;
    }

    static PollResponse from(PollResult result) {
        return new PollResponse(result.changed(), result.state());
    }
}
