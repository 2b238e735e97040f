package tech.rolesync.engine.report;

import java.util.Locale;

public enum OutputFormat {
    TEXT,
    JSON,
    YAML;

    /**
     * @throws IllegalArgumentException for an unknown name
     */
    public static OutputFormat parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
