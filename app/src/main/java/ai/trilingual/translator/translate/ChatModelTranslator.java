package ai.trilingual.translator.translate;

import ai.trilingual.translator.language.Language;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Translator backed by a LangChain4j {@link ChatModel} implementation.
 */
public class ChatModelTranslator implements Translator {

    private final ChatModel model;
    private final String providerName;
    private final String modelName;

    public ChatModelTranslator(ChatModel model, String providerName, String modelName) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.modelName = requireNonBlank(modelName, "modelName");
    }

    @Override
    public List<String> translate(TranslationRequest request) {
        Objects.requireNonNull(request, "request");
        String prompt = request.isCombined() ? buildCombinedPrompt(request) : buildSinglePrompt(request);
        String response;
        try {
            response = model.chat(prompt);
        } catch (RuntimeException ex) {
            if (isModelMissing(ex)) {
                throw new TranslationException("%s model '%s' is not available.".formatted(providerName, modelName), ex);
            }
            throw new TranslationException("LangChain translation failed: " + ex.getMessage(), ex);
        }
        if (response == null || response.isBlank()) {
            throw new TranslationException("Empty response from %s model '%s'".formatted(providerName, modelName));
        }
        return Arrays.stream(response.strip().split("\\R", -1))
                .map(String::stripTrailing)
                .collect(Collectors.toList());
    }

    private String buildCombinedPrompt(TranslationRequest request) {
        Language first = request.targets().get(0);
        Language second = request.targets().get(1);
        return """
You are a professional translator. Translate the following text from %1$s into %2$s and %3$s.

IMPORTANT: Provide ONLY the translations, one per line, in this exact order:
1. %2$s translation
2. %3$s translation

Do not include any explanations, labels, or additional text.

Text to translate: "%4$s"

Translations:""".formatted(request.source().displayName(), first.displayName(), second.displayName(), request.text());
    }

    private String buildSinglePrompt(TranslationRequest request) {
        String source = request.source().displayName();
        String target = request.targets().get(0).displayName();
        return """
You are a professional translator. Translate this text from %1$s into %2$s.

IMPORTANT: You must translate the text into %2$s. Do not keep it in %1$s.

Source language: %1$s
Target language: %2$s
Text to translate: "%3$s"

Translation in %2$s:""".formatted(source, target, request.text());
    }

    private boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
