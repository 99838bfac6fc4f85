package work.lcod.yamlfmt.model;

import java.util.Objects;

/**
 * Two-component YAML language version as declared by a {@code %YAML} directive.
 */
public record YamlVersion(int major, int minor) {
    public static final YamlVersion V1_1 = new YamlVersion(1, 1);
    public static final YamlVersion V1_2 = new YamlVersion(1, 2);

    public static YamlVersion parse(String raw) {
        Objects.requireNonNull(raw, "raw");
        String[] parts = raw.trim().split("\\.");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Unsupported YAML version: " + raw);
        }
        try {
            return new YamlVersion(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Unsupported YAML version: " + raw, ex);
        }
    }

    public boolean isLegacy() {
        return V1_1.equals(this);
    }

    @Override
    public String toString() {
        return major + "." + minor;
    }
}
