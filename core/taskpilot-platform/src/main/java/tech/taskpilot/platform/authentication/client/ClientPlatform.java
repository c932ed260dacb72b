package tech.taskpilot.platform.authentication.client;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Platforms a dynamic client may register for.
 */
public enum ClientPlatform {
    IOS,
    ANDROID,
    MACOS,
    WINDOWS,
    LINUX,
    CLI;

    /**
     * Lowercase value used on the wire ("ios", "cli", ...).
     */
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ClientPlatform> fromWireValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(p -> p.wireValue().equals(value))
            .findFirst();
    }

    public static String allowedValues() {
        return Arrays.stream(values()).map(ClientPlatform::wireValue).collect(Collectors.joining(", "));
    }
}
