package ai.trilingual.translator.translate;

import java.util.List;

/**
 * Low-level translator that performs one remote translation request.
 *
 * <p>Implementations return the raw response lines; a request with two targets expects one line per
 * target in the order of {@link TranslationRequest#targets()}. Failures are reported with
 * {@link TranslationException}.
 */
@FunctionalInterface
public interface Translator {

    List<String> translate(TranslationRequest request);
}
