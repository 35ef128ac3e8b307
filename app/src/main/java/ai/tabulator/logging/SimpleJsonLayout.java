package ai.tabulator.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * JSON-lines layout for logback. Each event becomes one object with timestamp, level, logger, thread
 * and message. The convergence pass number is lifted out of the MDC into a top-level {@code pass}
 * field so pass traces can be filtered without digging into {@code mdc}.
 */
public class SimpleJsonLayout extends LayoutBase<ILoggingEvent> {

    /** MDC key the convergence loop stores the current pass number under. */
    public static final String PASS_KEY = "pass";

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    @Override
    public String doLayout(ILoggingEvent event) {
        StringJoiner fields = new StringJoiner(",", "{", "}");
        fields.add(field("timestamp", ISO_FORMATTER.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC))));
        fields.add(field("level", String.valueOf(event.getLevel())));
        fields.add(field("logger", event.getLoggerName()));
        fields.add(field("thread", event.getThreadName()));

        Map<String, String> mdc = sortedMdc(event);
        String pass = mdc.remove(PASS_KEY);
        if (pass != null) {
            fields.add(quote(PASS_KEY) + ':' + (isNumber(pass) ? pass : quote(pass)));
        }
        fields.add(field("message", event.getFormattedMessage()));

        if (!mdc.isEmpty()) {
            StringJoiner entries = new StringJoiner(",", "{", "}");
            mdc.forEach((key, value) -> entries.add(quote(key) + ':' + quote(value)));
            fields.add(quote("mdc") + ':' + entries);
        }

        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            fields.add(field("exception", throwable.getClassName()));
            fields.add(field("exceptionMessage", throwable.getMessage()));
        }
        return fields + System.lineSeparator();
    }

    private static String field(String name, String value) {
        return quote(name) + ':' + quote(value);
    }

    private static Map<String, String> sortedMdc(ILoggingEvent event) {
        Map<String, String> map = event.getMDCPropertyMap();
        return map == null ? new TreeMap<>() : new TreeMap<>(map);
    }

    private static boolean isNumber(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    static String quote(String value) {
        if (value == null) {
            return "null";
        }
        StringBuilder escaped = new StringBuilder(value.length() + 16);
        escaped.append('"');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '\\' -> escaped.append("\\\\");
                case '"' -> escaped.append("\\\"");
                case '\n' -> escaped.append("\\n");
                case '\r' -> escaped.append("\\r");
                case '\t' -> escaped.append("\\t");
                default -> {
                    if (ch < 0x20) {
                        escaped.append(String.format("\\u%04x", (int) ch));
                    } else {
                        escaped.append(ch);
                    }
                }
            }
        }
        escaped.append('"');
        return escaped.toString();
    }
}
