package org.carball.insight.model.stage;

import java.util.Locale;

public enum ConfidenceLabel {
    HIGH,
    MEDIUM,
    LOW;

    /**
     * Lenient parse of "high", "Medium", "LOW"; anything else is {@link #LOW}.
     */
    public static ConfidenceLabel fromString(String value) {
        if (value == null) {
            return LOW;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "high" -> HIGH;
            case "medium" -> MEDIUM;
            default -> LOW;
        };
    }

    public ConfidenceLabel lower() {
        return this == HIGH ? MEDIUM : LOW;
    }
}
