package ai.statute.converter.xml;

/**
 * Runtime exception raised when a statute document cannot be transformed.
 */
public class StatuteConversionException extends RuntimeException {

    public StatuteConversionException(String message) {
        super(message);
    }

    public StatuteConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
