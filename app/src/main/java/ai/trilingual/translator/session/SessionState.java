package ai.trilingual.translator.session;

import ai.trilingual.translator.language.Language;
import ai.trilingual.translator.language.LanguageTexts;
import java.time.Instant;
import java.util.Objects;

/**
 * Authoritative translation state of one shared session.
 */
public record SessionState(String sessionId,
                           LanguageTexts texts,
                           Language activeLanguage,
                           long revision,
                           Instant updatedAt) {

    public static final Language DEFAULT_ACTIVE_LANGUAGE = Language.ENGLISH;

    public SessionState {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        texts = texts == null ? LanguageTexts.empty() : texts;
        Objects.requireNonNull(activeLanguage, "activeLanguage");
        if (revision < 0) {
            throw new IllegalArgumentException("revision must not be negative");
        }
        Objects.requireNonNull(updatedAt, "updatedAt");
    }

    public static SessionState initial(String sessionId, Instant createdAt) {
        return new SessionState(sessionId, LanguageTexts.empty(), DEFAULT_ACTIVE_LANGUAGE, 0L, createdAt);
    }

    public String text(Language language) {
        return texts.get(language);
    }

    /**
     * Replaces every text slot, marks {@code editedLanguage} active and advances the revision by one.
     */
    public SessionState withEdit(LanguageTexts newTexts, Language editedLanguage, Instant editedAt) {
        Instant stamp = editedAt.isAfter(updatedAt) ? editedAt : updatedAt;
        return new SessionState(sessionId, newTexts, editedLanguage, revision + 1, stamp);
    }
}
