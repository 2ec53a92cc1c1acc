package ai.trilingual.translator.translate;

import ai.trilingual.translator.language.Language;
import java.util.List;
import java.util.Objects;

/**
 * Outbound request to the translation service: one source, one or two targets, raw text.
 */
public record TranslationRequest(Language source, List<Language> targets, String text) {

    public TranslationRequest {
        Objects.requireNonNull(source, "source");
        targets = List.copyOf(Objects.requireNonNull(targets, "targets"));
        Objects.requireNonNull(text, "text");
        if (targets.isEmpty() || targets.size() > 2) {
            throw new IllegalArgumentException("A translation request needs one or two target languages");
        }
        if (targets.contains(source)) {
            throw new IllegalArgumentException("Target languages must not include the source language " + source);
        }
    }

    public static TranslationRequest single(Language source, Language target, String text) {
        return new TranslationRequest(source, List.of(target), text);
    }

    public boolean isCombined() {
        return targets.size() > 1;
    }
}
