package ai.statute.converter.cli;

import ai.statute.converter.config.LogFormat;
import picocli.CommandLine;

public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {

    @Override
    public LogFormat convert(String value) {
        return LogFormat.from(value);
    }
}
