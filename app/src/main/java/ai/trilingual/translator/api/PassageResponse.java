package ai.trilingual.translator.api;

import ai.trilingual.translator.language.Language;
import ai.trilingual.translator.language.LanguageTexts;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Translations for all three languages; the source slot echoes the submitted text.
 */
public record PassageResponse(boolean success,
                              LanguageTexts translations,
                              Set<Language> degradedLanguages,
                              Optional<String> error) {

    public PassageResponse {
        translations = translations == null ? LanguageTexts.empty() : translations;
        degradedLanguages = degradedLanguages == null ? Set.of() : Set.copyOf(degradedLanguages);
        error = error == null ? Optional.empty() : error;
    }

    public static PassageResponse success(LanguageTexts translations, Set<Language> degradedLanguages) {
        return new PassageResponse(true, Objects.requireNonNull(translations, "translations"), degradedLanguages, Optional.empty());
    }

    public static PassageResponse failure(String message) {
        return new PassageResponse(false, LanguageTexts.empty(), Set.of(), Optional.of(message));
    }
}
