package ai.statute.converter.xml;

/**
 * Raised when the input is not well-formed XML.
 */
public class MalformedXmlException extends StatuteConversionException {

    public MalformedXmlException(String message, Throwable cause) {
        super(message, cause);
    }
}
