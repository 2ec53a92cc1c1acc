package ai.trilingual.translator.language;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * The closed set of languages a session is authored in.
 */
public enum Language {
    ENGLISH("English", "en"),
    FRENCH("French", "fr"),
    POLISH("Polish", "pl");

    private final String displayName;
    private final String code;

    Language(String displayName, String code) {
        this.displayName = displayName;
        this.code = code;
    }

    public String displayName() {
        return displayName;
    }

    public String code() {
        return code;
    }

    /**
     * Returns the two languages other than {@code source}, always in declaration order.
     */
    public static List<Language> targetsFor(Language source) {
        if (source == null) {
            throw new IllegalArgumentException("source language must be provided");
        }
        List<Language> targets = new ArrayList<>(2);
        for (Language language : values()) {
            if (language != source) {
                targets.add(language);
            }
        }
        return List.copyOf(targets);
    }

    public static Language from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Language must be provided");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.name().toLowerCase(Locale.ROOT).equals(normalized)
                    || language.displayName.toLowerCase(Locale.ROOT).equals(normalized)
                    || language.code.equals(normalized)) {
                return language;
            }
        }
        throw new IllegalArgumentException("Unsupported language: " + raw);
    }
}
