package ai.trilingual.translator.translate;

import ai.trilingual.translator.language.Language;
import java.util.ArrayList;
import java.util.List;

/**
 * Mock translator that tags the source text with each target language code.
 */
public class MockTranslator implements Translator {

    @Override
    public List<String> translate(TranslationRequest request) {
        List<String> result = new ArrayList<>(request.targets().size());
        for (Language target : request.targets()) {
            result.add("[MOCK " + target.code() + "] " + request.text());
        }
        return result;
    }
}
