package ai.statute.converter.cli;

import ai.statute.converter.api.EgovLawApiClient;
import ai.statute.converter.api.LawApiException;
import ai.statute.converter.api.LawDocumentLoader;
import ai.statute.converter.api.LawIdResolver;
import ai.statute.converter.config.Config;
import ai.statute.converter.config.ConfigLoader;
import ai.statute.converter.config.SystemEnvironmentReader;
import ai.statute.converter.logging.LoggingConfigurator;
import ai.statute.converter.logging.SimpleJsonLayout;
import ai.statute.converter.output.LawDocumentRenderer;
import ai.statute.converter.output.OutputWriter;
import ai.statute.converter.xml.StatuteConversionException;
import java.io.UncheckedIOException;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and converter.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_CONVERSION_FAILED = 1;

    private final ConfigLoader configLoader;
    private final Function<Config, LawDocumentLoader> loaderFactory;
    private final LawDocumentRenderer renderer;
    private final OutputWriter outputWriter;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), CliApplication::createLoader,
                new LawDocumentRenderer(), new OutputWriter());
    }

    CliApplication(ConfigLoader configLoader,
                   Function<Config, LawDocumentLoader> loaderFactory,
                   LawDocumentRenderer renderer,
                   OutputWriter outputWriter) {
        this.configLoader = configLoader;
        this.loaderFactory = loaderFactory;
        this.renderer = renderer;
        this.outputWriter = outputWriter;
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

        Config config;
        try {
            commandLine.parseArgs(args);
            if (commandLine.isUsageHelpRequested()) {
                commandLine.usage(commandLine.getOut());
                return commandLine.getCommandSpec().exitCodeOnUsageHelp();
            }
            if (commandLine.isVersionHelpRequested()) {
                commandLine.printVersionHelp(commandLine.getOut());
                return commandLine.getCommandSpec().exitCodeOnVersionHelp();
            }
            config = configLoader.load(cliArguments);
        } catch (CommandLine.ParameterException | IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        LoggingConfigurator.configure(config.logFormat(), cliArguments.verbose());
        LOGGER.info("Converting {} {} to {}", config.source().kind().label(), config.source().value(), config.outputFormat());
        if (config.requiresApi()) {
            LOGGER.info("Using law API at {} (timeout {}s)", config.apiBaseUrl(), config.requestTimeout().toSeconds());
        }

        LawDocumentLoader loader = loaderFactory.apply(config);
        try {
            Optional<String> lawId = loader.lawIdOf(config.source());
            lawId.ifPresent(id -> MDC.put(SimpleJsonLayout.LAW_ID_KEY, id));
            String xml = loader.load(config.source());
            config.saveXmlFile().ifPresent(path -> outputWriter.write(path, xml));

            String converted = renderer.render(xml, config.outputFormat());
            if (config.outputFile().isPresent()) {
                outputWriter.write(config.outputFile().get(), converted);
            } else {
                outputWriter.print(converted);
            }
            return 0;
        } catch (StatuteConversionException | LawApiException | UncheckedIOException ex) {
            LOGGER.error("Conversion failed: {}", ex.getMessage(), ex);
            return EXIT_CONVERSION_FAILED;
        } finally {
            MDC.remove(SimpleJsonLayout.LAW_ID_KEY);
        }
    }

    private static LawDocumentLoader createLoader(Config config) {
        EgovLawApiClient client = new EgovLawApiClient(config.apiBaseUrl(), config.requestTimeout());
        return new LawDocumentLoader(client, new LawIdResolver(client));
    }
}
