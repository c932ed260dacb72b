package tech.taskpilot.task;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * How much focus a task needs.
 */
public enum Energy {
    LIGHT,
    MEDIUM,
    DEEP;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Energy> fromWireValue(String value) {
        return Arrays.stream(values()).filter(e -> e.wireValue().equals(value)).findFirst();
    }
}
