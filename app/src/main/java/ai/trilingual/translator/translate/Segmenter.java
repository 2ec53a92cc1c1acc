package ai.trilingual.translator.translate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Splits a passage into ordered {@link TranslationUnit}s and joins translated units back into a passage.
 */
public class Segmenter {

    public static final int DEFAULT_MAX_LINE_LENGTH = 100;

    private static final Pattern LINE_BREAK = Pattern.compile("\\R");
    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");

    private final int maxLineLength;

    public Segmenter() {
        this(DEFAULT_MAX_LINE_LENGTH);
    }

    public Segmenter(int maxLineLength) {
        if (maxLineLength < 1) {
            throw new IllegalArgumentException("maxLineLength must be at least 1");
        }
        this.maxLineLength = maxLineLength;
    }

    public List<TranslationUnit> segment(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<TranslationUnit> units = new ArrayList<>();
        for (String rawLine : LINE_BREAK.split(text)) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }
            if (line.length() <= maxLineLength) {
                units.add(new TranslationUnit(units.size(), line, true));
                continue;
            }
            boolean firstOfLine = true;
            for (String sentence : SENTENCE_BOUNDARY.split(line)) {
                String fragment = sentence.strip();
                if (fragment.isEmpty()) {
                    continue;
                }
                units.add(new TranslationUnit(units.size(), fragment, firstOfLine));
                firstOfLine = false;
            }
        }
        return List.copyOf(units);
    }

    /**
     * Joins translated unit texts in unit order. Multi-line sources keep one line break before every unit that
     * starts a source line; everything else is separated by a single space.
     */
    public String join(List<TranslationUnit> units, List<String> translatedTexts, String sourceText) {
        Objects.requireNonNull(units, "units");
        Objects.requireNonNull(translatedTexts, "translatedTexts");
        if (units.size() != translatedTexts.size()) {
            throw new IllegalArgumentException("Expected %d translated units but got %d"
                    .formatted(units.size(), translatedTexts.size()));
        }
        boolean multiline = hasLineBreak(sourceText);
        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < units.size(); i++) {
            if (i > 0) {
                joined.append(multiline && units.get(i).startsLine() ? "\n" : " ");
            }
            joined.append(translatedTexts.get(i));
        }
        return joined.toString();
    }

    static boolean hasLineBreak(String text) {
        return text != null && (text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0);
    }
}
