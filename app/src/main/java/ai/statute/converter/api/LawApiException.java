package ai.statute.converter.api;

import java.util.OptionalInt;

/**
 * Runtime exception for failed requests against the law API.
 */
public class LawApiException extends RuntimeException {

    private final OptionalInt statusCode;

    public LawApiException(String message) {
        super(message);
        this.statusCode = OptionalInt.empty();
    }

    public LawApiException(String message, int statusCode) {
        super(message);
        this.statusCode = OptionalInt.of(statusCode);
    }

    public LawApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = OptionalInt.empty();
    }

    public OptionalInt statusCode() {
        return statusCode;
    }
}
