package ai.statute.converter.extract;

import ai.statute.converter.xml.StatuteConversionException;

/**
 * Raised when a main provision has neither chapters nor articles at its top level.
 */
public class UnknownStructureException extends StatuteConversionException {

    public UnknownStructureException(String message) {
        super(message);
    }
}
