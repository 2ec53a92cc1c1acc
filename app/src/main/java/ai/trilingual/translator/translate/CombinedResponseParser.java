package ai.trilingual.translator.translate;

import ai.trilingual.translator.language.Language;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Cleans model responses: numbered or bulleted lines for combined requests, a single quoted string otherwise.
 */
class CombinedResponseParser {

    private static final Pattern ENUMERATION = Pattern.compile("^(?:\\d{1,2}\\s*[.):]|[-*•])\\s*");

    /**
     * Returns the non-blank lines of a combined response with enumeration markers and language labels removed.
     */
    List<String> parseCombined(List<String> responseLines) {
        List<String> cleaned = new ArrayList<>();
        if (responseLines == null) {
            return cleaned;
        }
        for (String raw : responseLines) {
            if (raw == null) {
                continue;
            }
            String line = ENUMERATION.matcher(raw.strip()).replaceFirst("");
            line = stripLanguageLabel(line).strip();
            if (!line.isEmpty()) {
                cleaned.add(line);
            }
        }
        return cleaned;
    }

    /**
     * Returns the translated text of a single-target response, or an empty string when nothing usable came back.
     */
    String parseSingle(List<String> responseLines) {
        if (responseLines == null || responseLines.isEmpty()) {
            return "";
        }
        String translated = String.join("\n", responseLines).strip();
        if (translated.length() >= 2) {
            char first = translated.charAt(0);
            char last = translated.charAt(translated.length() - 1);
            if ((first == '"' && last == '"') || (first == '\'' && last == '\'')
                    || (first == '“' && last == '”')) {
                translated = translated.substring(1, translated.length() - 1).strip();
            }
        }
        return translated;
    }

    private String stripLanguageLabel(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        for (Language language : Language.values()) {
            String label = language.displayName().toLowerCase(Locale.ROOT) + ":";
            if (lower.startsWith(label)) {
                return line.substring(label.length());
            }
        }
        return line;
    }
}
