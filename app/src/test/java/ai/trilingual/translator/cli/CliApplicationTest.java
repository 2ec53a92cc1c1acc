package ai.trilingual.translator.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.trilingual.translator.config.Config;
import ai.trilingual.translator.config.ConfigLoader;
import ai.trilingual.translator.config.LlmProvider;
import ai.trilingual.translator.config.LogFormat;
import ai.trilingual.translator.config.Secrets;
import ai.trilingual.translator.config.TranslatorConfig;
import ai.trilingual.translator.language.Language;
import ai.trilingual.translator.translate.RetryPolicy;
import ai.trilingual.translator.translate.TranslationMode;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CliApplicationTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void runPrintsAllThreeLanguagesInMockMode() {
        CliApplication application = application(new FixedConfigLoader(config(Language.ENGLISH)), InputStream.nullInputStream());

        int exitCode = application.run(new String[] {"--text", "Hello."});

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("Session classroom revision 1 (active: English)")
                .contains("[English] Hello.")
                .contains("[French] [MOCK fr] Hello.")
                .contains("[Polish] [MOCK pl] Hello.");
    }

    @Test
    void readsPassageFromStandardInputWhenTextOmitted() {
        InputStream input = new ByteArrayInputStream("Bonjour.\nÇa va ?".getBytes(StandardCharsets.UTF_8));
        CliApplication application = application(new FixedConfigLoader(config(Language.FRENCH)), input);

        int exitCode = application.run(new String[0]);

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("[English] [MOCK en] Bonjour.\n[MOCK en] Ça va ?")
                .contains("[French] Bonjour.\nÇa va ?");
    }

    @Test
    void invalidLanguageOptionFailsWithUsage() {
        CliApplication application = application(new FixedConfigLoader(config(Language.ENGLISH)), InputStream.nullInputStream());

        int exitCode = application.run(new String[] {"--language", "klingon"});

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Usage: live-translator");
    }

    @Test
    void configurationErrorExitsWithOne() {
        ConfigLoader loader = new ConfigLoader(key -> Optional.empty());
        CliApplication application = application(loader, InputStream.nullInputStream());

        int exitCode = application.run(new String[] {"--text", "Hello."});

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("GEMINI_API_KEY");
    }

    private CliApplication application(ConfigLoader loader, InputStream input) {
        return new CliApplication(loader, input, new PrintWriter(out, true), new PrintWriter(err, true));
    }

    private static Config config(Language language) {
        return new Config("classroom",
                language,
                TranslationMode.MOCK,
                LogFormat.TEXT,
                new TranslatorConfig(LlmProvider.GEMINI, "gemini-2.5-flash", Optional.empty(), Duration.ofSeconds(30)),
                Secrets.none(),
                RetryPolicy.noRetry(),
                1,
                Duration.ofSeconds(5),
                100);
    }

    private static final class FixedConfigLoader extends ConfigLoader {

        private final Config config;

        FixedConfigLoader(Config config) {
            super(key -> Optional.empty());
            this.config = config;
        }

        @Override
        public Config load(CliArguments arguments) {
            return config;
        }
    }
}
