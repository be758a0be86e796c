package io.holdings.http;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * How the identity of an upstream TLS endpoint is checked. {@link #verify()} is the default;
 * {@link #disabled()} exists for test endpoints and must be chosen explicitly.
 *
 * <p>Text form, as accepted by {@link #parse(String)}: {@code verify} (alias {@code always}),
 * {@code custom-ca:<path to PEM or DER bundle>}, {@code disabled}.
 */
public final class TlsPolicy {
    public enum Mode { VERIFY, CUSTOM_CA, DISABLED }

    private static final String CUSTOM_CA_PREFIX = "custom-ca:";
    private static final TlsPolicy VERIFY = new TlsPolicy(Mode.VERIFY, null);
    private static final TlsPolicy DISABLED = new TlsPolicy(Mode.DISABLED, null);

    private final Mode mode;
    private final Path caBundle;

    private TlsPolicy(Mode mode, Path caBundle) {
        this.mode = mode;
        this.caBundle = caBundle;
    }

    public static TlsPolicy verify() { return VERIFY; }

    public static TlsPolicy customCa(Path caBundle) {
        return new TlsPolicy(Mode.CUSTOM_CA, Objects.requireNonNull(caBundle, "caBundle"));
    }

    public static TlsPolicy disabled() { return DISABLED; }

    public static TlsPolicy parse(String text) {
        if (text == null || text.isBlank()) return VERIFY;
        String t = text.trim();
        String lower = t.toLowerCase(Locale.ROOT);
        if (lower.equals("verify") || lower.equals("always")) return VERIFY;
        if (lower.equals("disabled")) return DISABLED;
        if (lower.startsWith(CUSTOM_CA_PREFIX)) {
            String path = t.substring(CUSTOM_CA_PREFIX.length()).trim();
            if (path.isEmpty()) throw new IllegalArgumentException("custom-ca requires a path: " + text);
            return customCa(Path.of(path));
        }
        throw new IllegalArgumentException("Unknown TLS policy '" + text + "', expected verify|custom-ca:<path>|disabled");
    }

    public Mode mode() { return mode; }

    /** Bundle path for {@link Mode#CUSTOM_CA}, otherwise null. */
    public Path caBundle() { return caBundle; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TlsPolicy that)) return false;
        return mode == that.mode && Objects.equals(caBundle, that.caBundle);
    }

    @Override
    public int hashCode() { return Objects.hash(mode, caBundle); }

    @Override
    public String toString() {
        return switch (mode) {
            case VERIFY -> "verify";
            case DISABLED -> "disabled";
            case CUSTOM_CA -> CUSTOM_CA_PREFIX + caBundle;
        };
    }
}
