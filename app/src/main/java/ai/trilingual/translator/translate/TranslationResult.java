package ai.trilingual.translator.translate;

import ai.trilingual.translator.language.Language;
import ai.trilingual.translator.language.LanguageTexts;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Whole-passage translation. The source slot of {@link #texts()} echoes the input; the two target slots hold the
 * reassembled translations.
 */
public record TranslationResult(Language source,
                                LanguageTexts texts,
                                Set<Language> degradedLanguages,
                                List<UnitTranslation> units) {

    public TranslationResult {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(texts, "texts");
        degradedLanguages = degradedLanguages == null ? Set.of() : Set.copyOf(degradedLanguages);
        if (degradedLanguages.contains(source)) {
            throw new IllegalArgumentException("The source language cannot be degraded");
        }
        units = units == null ? List.of() : List.copyOf(units);
    }

    public static TranslationResult empty(Language source, String sourceText) {
        return new TranslationResult(source, LanguageTexts.empty().with(source, sourceText), Set.of(), List.of());
    }

    public List<Language> targets() {
        return Language.targetsFor(source);
    }

    public String translation(Language target) {
        if (target == source) {
            throw new IllegalArgumentException(target + " is the source language of this result");
        }
        return texts.get(target);
    }

    public boolean isDegraded() {
        return !degradedLanguages.isEmpty();
    }
}
