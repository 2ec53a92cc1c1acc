package ai.trilingual.translator.api;

import ai.trilingual.translator.language.Language;
import java.util.Set;

/**
 * Confirms an applied edit with the revision it produced.
 */
public record EditAcknowledgement(String sessionId, long revision, Set<Language> degradedLanguages) {

    public EditAcknowledgement {
        degradedLanguages = degradedLanguages == null ? Set.of() : Set.copyOf(degradedLanguages);
    }
}
