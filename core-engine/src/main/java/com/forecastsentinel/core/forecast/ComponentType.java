package com.forecastsentinel.core.forecast;

import java.util.Locale;

/**
 * How a trend or seasonal component combines with the level.
 *
 * @since 1.0.0
 */
public enum ComponentType {
    NONE, ADDITIVE, MULTIPLICATIVE;

    /**
     * Parse a configuration value, case-insensitively. {@code null} and blank
     * values mean {@link #NONE}; {@code add} and {@code mul} are accepted as
     * short forms.
     *
     * @param name configuration value
     * @return the matching component type
     * @throws IllegalArgumentException if the name is not recognised
     */
    public static ComponentType fromString(String name) {
        if (name == null || name.isBlank()) {
            return NONE;
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "none" -> NONE;
            case "add", "additive" -> ADDITIVE;
            case "mul", "multiplicative" -> MULTIPLICATIVE;
            default -> throw new IllegalArgumentException(
                    "Unknown component type: '" + name + "'. Supported: none, additive, multiplicative");
        };
    }
}
