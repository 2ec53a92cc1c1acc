package ai.trilingual.translator.cli;

import ai.trilingual.translator.config.LogFormat;
import ai.trilingual.translator.language.Language;
import ai.trilingual.translator.translate.TranslationMode;
import java.util.function.Function;
import picocli.CommandLine;

/**
 * picocli converters for the enum-valued options; parse failures name the accepted values.
 */
final class OptionConverters {

    private OptionConverters() {
    }

    static final class LanguageConverter implements CommandLine.ITypeConverter<Language> {
        @Override
        public Language convert(String value) {
            return parse(value, Language::from, "english, french, polish (or en, fr, pl)");
        }
    }

    static final class TranslationModeConverter implements CommandLine.ITypeConverter<TranslationMode> {
        @Override
        public TranslationMode convert(String value) {
            return parse(value, TranslationMode::from, "production, dry-run, mock");
        }
    }

    static final class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {
        @Override
        public LogFormat convert(String value) {
            return parse(value, LogFormat::from, "text, json");
        }
    }

    private static <T> T parse(String value, Function<String, T> parser, String accepted) {
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage() + "; expected one of: " + accepted);
        }
    }
}
