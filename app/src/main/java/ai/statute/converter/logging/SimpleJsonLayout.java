package ai.statute.converter.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON-lines layout. The {@code lawId} MDC entry becomes a top-level field; other MDC entries
 * are nested under {@code mdc}.
 */
public class SimpleJsonLayout extends LayoutBase<ILoggingEvent> {

    public static final String LAW_ID_KEY = "lawId";

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    @Override
    public String doLayout(ILoggingEvent event) {
        Map<String, String> mdc = new TreeMap<>(mdcOf(event));
        String lawId = mdc.remove(LAW_ID_KEY);

        StringBuilder json = new StringBuilder(256).append('{');
        field(json, "timestamp", ISO_FORMATTER.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
        json.append(',');
        field(json, "level", String.valueOf(event.getLevel()));
        json.append(',');
        field(json, "logger", event.getLoggerName());
        if (lawId != null) {
            json.append(',');
            field(json, LAW_ID_KEY, lawId);
        }
        json.append(',');
        field(json, "message", event.getFormattedMessage());
        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            json.append(',');
            field(json, "error", throwable.getClassName() + ": " + throwable.getMessage());
        }
        if (!mdc.isEmpty()) {
            json.append(",\"mdc\":{");
            boolean first = true;
            for (Map.Entry<String, String> entry : mdc.entrySet()) {
                if (!first) {
                    json.append(',');
                }
                field(json, entry.getKey(), entry.getValue());
                first = false;
            }
            json.append('}');
        }
        return json.append('}').append(System.lineSeparator()).toString();
    }

    private static Map<String, String> mdcOf(ILoggingEvent event) {
        Map<String, String> map = event.getMDCPropertyMap();
        return map == null ? Map.of() : map;
    }

    private static void field(StringBuilder json, String name, String value) {
        quote(json, name);
        json.append(':');
        quote(json, value);
    }

    static void quote(StringBuilder json, String value) {
        if (value == null) {
            json.append("null");
            return;
        }
        json.append('"');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '\\' -> json.append("\\\\");
                case '"' -> json.append("\\\"");
                case '\n' -> json.append("\\n");
                case '\r' -> json.append("\\r");
                case '\t' -> json.append("\\t");
                default -> {
                    if (ch < 0x20) {
                        json.append(String.format("\\u%04x", (int) ch));
                    } else {
                        json.append(ch);
                    }
                }
            }
        }
        json.append('"');
    }
}
