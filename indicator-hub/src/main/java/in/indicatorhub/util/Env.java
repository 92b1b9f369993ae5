package in.indicatorhub.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.function.Function;

/**
 * Environment variable utilities. System properties are consulted when the
 * variable is not set, which lets tests override values with -D or
 * {@link System#setProperty}.
 */
public final class Env {
    private static final Logger log = LoggerFactory.getLogger(Env.class);

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        return parse(key, defaultValue, Integer::valueOf, "an integer");
    }

    public static long getLong(String key, long defaultValue) {
        return parse(key, defaultValue, Long::valueOf, "a whole number");
    }

    public static double getDouble(String key, double defaultValue) {
        return parse(key, defaultValue, Double::valueOf, "a decimal");
    }

    /**
     * true / 1 / yes / on, case-insensitive; anything else is false.
     */
    public static boolean getBool(String key, boolean defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> true;
            default -> false;
        };
    }

    private static <T> T parse(String key, T defaultValue, Function<String, T> parser, String expected) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return parser.apply(value);
        } catch (NumberFormatException e) {
            log.warn("[Env] {}='{}' is not {}, using {}", key, value, expected, defaultValue);
            return defaultValue;
        }
    }

    private Env() {}
}
