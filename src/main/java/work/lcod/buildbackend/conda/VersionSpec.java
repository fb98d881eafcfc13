package work.lcod.buildbackend.conda;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Objects;

/**
 * A version constraint such as {@code >=1.0,<2} or {@code 3.12.*}. The constraint is validated
 * on construction and kept in its whitespace-free textual form.
 */
public final class VersionSpec {
    public static final VersionSpec ANY = new VersionSpec("*");

    private static final List<String> OPERATORS = List.of(">=", "<=", "==", "!=", "~=", ">", "<", "=");

    private final String text;

    private VersionSpec(String text) {
        this.text = text;
    }

    @JsonCreator
    public static VersionSpec parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("version spec must not be null");
        }
        String compact = raw.replaceAll("\\s+", "");
        if (compact.isEmpty() || "*".equals(compact)) {
            return ANY;
        }
        for (String alternative : compact.split("\\|", -1)) {
            for (String constraint : alternative.split(",", -1)) {
                validateConstraint(constraint, raw);
            }
        }
        return new VersionSpec(compact);
    }

    private static void validateConstraint(String constraint, String raw) {
        if (constraint.isEmpty()) {
            throw new IllegalArgumentException("empty constraint in version spec '" + raw + "'");
        }
        String version = constraint;
        for (String operator : OPERATORS) {
            if (constraint.startsWith(operator)) {
                version = constraint.substring(operator.length());
                break;
            }
        }
        if (version.endsWith(".*")) {
            version = version.substring(0, version.length() - 2);
        } else if (version.endsWith("*") && version.length() > 1) {
            version = version.substring(0, version.length() - 1);
        }
        if ("*".equals(version)) {
            return;
        }
        try {
            Version.parse(version);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("invalid version spec '" + raw + "': " + ex.getMessage(), ex);
        }
    }

    public boolean isAny() {
        return this == ANY;
    }

    @JsonValue
    @Override
    public String toString() {
        return text;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof VersionSpec other && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text);
    }
}
