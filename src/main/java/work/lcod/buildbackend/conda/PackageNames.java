package work.lcod.buildbackend.conda;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validation and normalization of conda package names.
 */
public final class PackageNames {
    private static final Pattern VALID = Pattern.compile("[a-z0-9_][a-z0-9_.\\-]*");

    private PackageNames() {}

    /**
     * Returns the lower-cased name, or throws if it contains characters conda does not accept.
     */
    public static String normalize(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("package name must not be empty");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if (!VALID.matcher(normalized).matches()) {
            throw new IllegalArgumentException("'" + name + "' is not a valid package name");
        }
        return normalized;
    }
}
