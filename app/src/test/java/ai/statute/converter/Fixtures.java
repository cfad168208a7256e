package ai.statute.converter;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads XML fixtures from the test classpath.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static String read(String name) {
        try (InputStream stream = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (stream == null) {
                throw new IllegalArgumentException("Missing fixture: " + name);
            }
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    /**
     * Wraps a main provision fragment into a complete law data response.
     */
    public static String lawDocument(String lawBodyContent) {
        return "<law_data_response><law_full_text><Law><LawBody>"
                + lawBodyContent
                + "</LawBody></Law></law_full_text></law_data_response>";
    }
}
