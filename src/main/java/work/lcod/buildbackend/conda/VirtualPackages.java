package work.lcod.buildbackend.conda;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detection of the virtual packages ({@code __unix}, {@code __linux}, {@code __osx}, ...) of the
 * current machine. {@code CONDA_OVERRIDE_<NAME>} replaces a detected version; an empty override
 * removes the package.
 */
public final class VirtualPackages {
    private static final Pattern NUMERIC_VERSION = Pattern.compile("^(\\d+(?:\\.\\d+)*)");

    private VirtualPackages() {}

    public static List<GenericVirtualPackage> detect(Platform platform, Map<String, String> env) {
        List<GenericVirtualPackage> packages = new ArrayList<>();
        String osVersion = numericPrefix(System.getProperty("os.version", "")).orElse("0");
        if (platform.isUnix()) {
            packages.add(new GenericVirtualPackage("__unix", "0", "0"));
        }
        if (platform.isWindows()) {
            packages.add(new GenericVirtualPackage("__win", "0", "0"));
        }
        if (platform.isLinux()) {
            addWithOverride(packages, env, "__linux", "LINUX", osVersion);
            addWithOverride(packages, env, "__glibc", "GLIBC", null);
        }
        if (platform.isOsx()) {
            addWithOverride(packages, env, "__osx", "OSX", osVersion);
        }
        addWithOverride(packages, env, "__cuda", "CUDA", null);
        String archspec = env.getOrDefault("CONDA_OVERRIDE_ARCHSPEC", archspecOf(platform));
        if (archspec != null && !archspec.isBlank()) {
            packages.add(new GenericVirtualPackage("__archspec", "1", archspec));
        }
        return List.copyOf(packages);
    }

    private static void addWithOverride(
        List<GenericVirtualPackage> packages,
        Map<String, String> env,
        String name,
        String overrideSuffix,
        String detected
    ) {
        String key = "CONDA_OVERRIDE_" + overrideSuffix;
        String version = env.containsKey(key) ? env.get(key) : detected;
        if (version == null || version.isBlank()) {
            return;
        }
        packages.add(new GenericVirtualPackage(name, version.trim(), "0"));
    }

    private static String archspecOf(Platform platform) {
        String subdir = platform.subdir();
        String arch = subdir.substring(subdir.indexOf('-') + 1).toLowerCase(Locale.ROOT);
        switch (arch) {
            case "64":
                return "x86_64";
            case "32":
                return "x86";
            case "arm64":
                return platform.isOsx() ? "m1" : "aarch64";
            default:
                return platform == Platform.NOARCH ? null : arch;
        }
    }

    private static Optional<String> numericPrefix(String raw) {
        Matcher matcher = NUMERIC_VERSION.matcher(raw.trim());
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
