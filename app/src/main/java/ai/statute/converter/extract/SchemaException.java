package ai.statute.converter.extract;

import ai.statute.converter.xml.StatuteConversionException;
import java.util.Objects;

/**
 * Raised when a required wrapper element of the law document is absent.
 */
public class SchemaException extends StatuteConversionException {

    private final MissingElement missingElement;

    public SchemaException(MissingElement missingElement) {
        super(Objects.requireNonNull(missingElement, "missingElement").describe());
        this.missingElement = missingElement;
    }

    public MissingElement missingElement() {
        return missingElement;
    }

    /**
     * Each link of the path {@code law_full_text/Law/LawBody/MainProvision} that can be missing.
     */
    public enum MissingElement {
        LAW_FULL_TEXT("law_full_text", "document root"),
        LAW("Law", "law_full_text"),
        LAW_BODY("LawBody", "Law"),
        MAIN_PROVISION("MainProvision", "LawBody");

        private final String tagName;
        private final String parentName;

        MissingElement(String tagName, String parentName) {
            this.tagName = tagName;
            this.parentName = parentName;
        }

        public String tagName() {
            return tagName;
        }

        String describe() {
            return "<" + tagName + "> element not found in " + parentName;
        }
    }
}
