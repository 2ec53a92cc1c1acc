package ai.trilingual.translator.language;

import java.util.Objects;

/**
 * One text slot per {@link Language}. Slots are never null.
 */
public record LanguageTexts(String english, String french, String polish) {

    private static final LanguageTexts EMPTY = new LanguageTexts("", "", "");

    public LanguageTexts {
        english = english == null ? "" : english;
        french = french == null ? "" : french;
        polish = polish == null ? "" : polish;
    }

    public static LanguageTexts empty() {
        return EMPTY;
    }

    public String get(Language language) {
        Objects.requireNonNull(language, "language");
        return switch (language) {
            case ENGLISH -> english;
            case FRENCH -> french;
            case POLISH -> polish;
        };
    }

    public LanguageTexts with(Language language, String text) {
        Objects.requireNonNull(language, "language");
        return switch (language) {
            case ENGLISH -> new LanguageTexts(text, french, polish);
            case FRENCH -> new LanguageTexts(english, text, polish);
            case POLISH -> new LanguageTexts(english, french, text);
        };
    }

    public boolean isEmpty() {
        return english.isEmpty() && french.isEmpty() && polish.isEmpty();
    }
}
