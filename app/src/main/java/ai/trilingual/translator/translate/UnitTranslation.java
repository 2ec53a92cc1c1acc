package ai.trilingual.translator.translate;

import ai.trilingual.translator.language.Language;
import ai.trilingual.translator.language.LanguageTexts;
import java.util.Objects;
import java.util.Set;

/**
 * Translation outcome for a single unit.
 */
public record UnitTranslation(TranslationUnit unit, LanguageTexts texts, UnitStatus status, Set<Language> failedLanguages) {

    public UnitTranslation {
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(texts, "texts");
        Objects.requireNonNull(status, "status");
        failedLanguages = failedLanguages == null ? Set.of() : Set.copyOf(failedLanguages);
    }
}
