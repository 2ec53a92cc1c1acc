package ai.trilingual.translator.translate;

import java.util.Collections;
import java.util.List;

/**
 * Translator used for dry-run scenarios that echoes the source text for every target without invoking remote APIs.
 */
public class PassThroughTranslator implements Translator {

    @Override
    public List<String> translate(TranslationRequest request) {
        if (request == null) {
            return List.of();
        }
        return Collections.nCopies(request.targets().size(), request.text());
    }
}
