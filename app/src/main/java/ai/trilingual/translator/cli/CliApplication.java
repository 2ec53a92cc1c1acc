package ai.trilingual.translator.cli;

import ai.trilingual.translator.api.EditAcknowledgement;
import ai.trilingual.translator.api.EditRequest;
import ai.trilingual.translator.api.InvalidRequestException;
import ai.trilingual.translator.api.LiveTranslationService;
import ai.trilingual.translator.config.Config;
import ai.trilingual.translator.config.ConfigLoader;
import ai.trilingual.translator.config.EnvironmentReader;
import ai.trilingual.translator.config.Secrets;
import ai.trilingual.translator.config.TranslatorConfig;
import ai.trilingual.translator.language.Language;
import ai.trilingual.translator.logging.LoggingConfigurator;
import ai.trilingual.translator.session.InMemorySessionStore;
import ai.trilingual.translator.session.SessionState;
import ai.trilingual.translator.session.SessionSynchronizer;
import ai.trilingual.translator.session.Subscription;
import ai.trilingual.translator.translate.ChatModelTranslator;
import ai.trilingual.translator.translate.MockTranslator;
import ai.trilingual.translator.translate.PassThroughTranslator;
import ai.trilingual.translator.translate.RetryingTranslator;
import ai.trilingual.translator.translate.Segmenter;
import ai.trilingual.translator.translate.TranslationOrchestrator;
import ai.trilingual.translator.translate.Translator;
import ai.trilingual.translator.translate.TranslatorFactory;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration, translation orchestrator and session synchronizer.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final InputStream input;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), System.in,
                new PrintWriter(System.out, true, StandardCharsets.UTF_8),
                new PrintWriter(System.err, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, InputStream input, PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.input = input;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode = new CliApplication().run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            err.println("Invalid configuration: " + ex.getMessage());
            return 1;
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Joining session {} as {} (translationMode={})",
                config.sessionId(), config.language(), config.translationMode());

        String text;
        try {
            text = cliArguments.text() != null ? cliArguments.text() : new String(input.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            LOGGER.error("Failed to read passage from standard input", ex);
            err.println("Failed to read passage from standard input: " + ex.getMessage());
            return 1;
        }

        Translator translator;
        try {
            translator = new RetryingTranslator(
                    buildTranslatorFactory(config).select(config.translationMode()), config.retryPolicy());
        } catch (IllegalStateException ex) {
            LOGGER.error("Failed to initialize translator", ex);
            err.println("Failed to initialize translator: " + ex.getMessage());
            return 1;
        }
        try (TranslationOrchestrator orchestrator = new TranslationOrchestrator(translator,
                new Segmenter(config.maxLineLength()), config.fallbackWorkers(), config.fallbackTimeout())) {
            LiveTranslationService service = new LiveTranslationService(orchestrator,
                    new SessionSynchronizer(new InMemorySessionStore()));
            List<SessionState> pushed = new CopyOnWriteArrayList<>();
            try (Subscription ignored = service.connect(config.sessionId(), pushed::add)) {
                EditAcknowledgement acknowledgement = service.submitEdit(
                        new EditRequest(config.sessionId(), config.language().name(), text));
                if (!acknowledgement.degradedLanguages().isEmpty()) {
                    LOGGER.warn("Translation degraded for {}", acknowledgement.degradedLanguages());
                }
                print(pushed.get(pushed.size() - 1));
            }
        } catch (InvalidRequestException ex) {
            err.println("Invalid request: " + ex.getMessage());
            return 1;
        }
        return 0;
    }

    private void print(SessionState state) {
        out.printf("Session %s revision %d (active: %s)%n",
                state.sessionId(), state.revision(), state.activeLanguage().displayName());
        for (Language language : Language.values()) {
            out.printf("[%s] %s%n", language.displayName(), state.text(language));
        }
        out.flush();
    }

    private TranslatorFactory buildTranslatorFactory(Config config) {
        if (!config.translationMode().isRemote()) {
            return TranslatorFactory.offline();
        }
        TranslatorConfig translatorConfig = config.translatorConfig();
        ChatModel chatModel = createChatModel(config);
        Translator productionTranslator = new ChatModelTranslator(chatModel, translatorConfig.provider().name(), translatorConfig.modelName());
        return new TranslatorFactory(productionTranslator, new PassThroughTranslator(), new MockTranslator());
    }

    private ChatModel createChatModel(Config config) {
        TranslatorConfig translatorConfig = config.translatorConfig();
        return switch (translatorConfig.provider()) {
            case OLLAMA -> createOllamaChatModel(translatorConfig);
            case GEMINI -> createGeminiChatModel(translatorConfig, config.secrets());
        };
    }

    private ChatModel createOllamaChatModel(TranslatorConfig translatorConfig) {
        try {
            String baseUrl = translatorConfig.baseUrl()
                    .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
            LOGGER.info("Using Ollama model '{}' via {}", translatorConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(translatorConfig.modelName())
                    .temperature(0.1)
                    .timeout(translatorConfig.timeout())
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private ChatModel createGeminiChatModel(TranslatorConfig translatorConfig, Secrets secrets) {
        String apiKey = secrets.geminiApiKey()
                .orElseThrow(() -> new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", translatorConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(translatorConfig.modelName())
                    .temperature(0.1)
                    .timeout(translatorConfig.timeout())
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }
}
