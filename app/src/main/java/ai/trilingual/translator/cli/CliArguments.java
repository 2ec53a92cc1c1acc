package ai.trilingual.translator.cli;

import ai.trilingual.translator.config.LogFormat;
import ai.trilingual.translator.language.Language;
import ai.trilingual.translator.translate.TranslationMode;
import picocli.CommandLine;

@CommandLine.Command(name = "live-translator", mixinStandardHelpOptions = true,
        description = "Translates a passage between English, French and Polish and publishes it to a shared session")
public class CliArguments {

    @CommandLine.Option(names = "--session", description = "Shared session id", paramLabel = "ID")
    private String sessionId;

    @CommandLine.Option(names = "--language", converter = OptionConverters.LanguageConverter.class,
            description = "Language the passage is written in: english, french or polish", paramLabel = "LANG")
    private Language language;

    @CommandLine.Option(names = "--text", description = "Passage to translate; read from standard input when omitted", paramLabel = "TEXT")
    private String text;

    @CommandLine.Option(names = "--translation-mode", description = "Translation execution mode: production, dry-run, or mock", converter = OptionConverters.TranslationModeConverter.class)
    private TranslationMode translationMode;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = OptionConverters.LogFormatConverter.class)
    private LogFormat logFormat;

    public String sessionId() {
        return sessionId;
    }

    public Language language() {
        return language;
    }

    public String text() {
        return text;
    }

    public TranslationMode translationMode() {
        return translationMode;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
