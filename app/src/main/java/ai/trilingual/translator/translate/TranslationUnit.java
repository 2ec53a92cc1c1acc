package ai.trilingual.translator.translate;

import java.util.Objects;

/**
 * One independently translated span of the source passage.
 *
 * @param index      position of the unit within the passage
 * @param text       stripped source text
 * @param startsLine whether the unit is the first one of its source line
 */
public record TranslationUnit(int index, String text, boolean startsLine) {

    public TranslationUnit {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative");
        }
        Objects.requireNonNull(text, "text");
    }
}
