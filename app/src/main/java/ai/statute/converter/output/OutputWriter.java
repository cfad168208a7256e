package ai.statute.converter.output;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes converted documents and raw law XML as UTF-8 files, or converted output to a console stream.
 */
public class OutputWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(OutputWriter.class);

    private final PrintStream console;

    public OutputWriter() {
        this(new PrintStream(System.out, true, StandardCharsets.UTF_8));
    }

    public OutputWriter(PrintStream console) {
        this.console = Objects.requireNonNull(console, "console");
    }

    public void write(Path target, String content) {
        if (target == null || content == null) {
            throw new IllegalArgumentException("target and content must be provided");
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            LOGGER.info("Wrote {} characters to {}", content.length(), target);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write " + target, ex);
        }
    }

    public void print(String content) {
        console.println(content);
        console.flush();
    }
}
