package ai.trilingual.translator.config;

import java.util.Optional;

/**
 * Holds credentials for the translation model provider.
 */
public record Secrets(Optional<String> geminiApiKey) {

    public Secrets {
        geminiApiKey = geminiApiKey == null ? Optional.empty() : geminiApiKey.filter(value -> !value.isBlank());
    }

    public static Secrets none() {
        return new Secrets(Optional.empty());
    }

    @Override
    public String toString() {
        return "Secrets[geminiApiKey=" + (geminiApiKey.isPresent() ? "***" : "<absent>") + "]";
    }
}
