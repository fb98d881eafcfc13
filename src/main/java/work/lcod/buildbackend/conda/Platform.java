package work.lcod.buildbackend.conda;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Conda subdirectories a package can be built for.
 */
public enum Platform {
    NOARCH("noarch"),
    LINUX_32("linux-32"),
    LINUX_64("linux-64"),
    LINUX_AARCH64("linux-aarch64"),
    LINUX_ARMV7L("linux-armv7l"),
    LINUX_PPC64LE("linux-ppc64le"),
    LINUX_S390X("linux-s390x"),
    LINUX_RISCV64("linux-riscv64"),
    OSX_64("osx-64"),
    OSX_ARM64("osx-arm64"),
    WIN_32("win-32"),
    WIN_64("win-64"),
    WIN_ARM64("win-arm64"),
    EMSCRIPTEN_WASM32("emscripten-wasm32"),
    WASI_WASM32("wasi-wasm32");

    private final String subdir;

    Platform(String subdir) {
        this.subdir = subdir;
    }

    @JsonValue
    public String subdir() {
        return subdir;
    }

    public boolean isWindows() {
        return subdir.startsWith("win-");
    }

    public boolean isOsx() {
        return subdir.startsWith("osx-");
    }

    public boolean isLinux() {
        return subdir.startsWith("linux-");
    }

    public boolean isUnix() {
        return isLinux() || isOsx();
    }

    @JsonCreator
    public static Platform parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("platform must not be empty");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Platform platform : values()) {
            if (platform.subdir.equals(normalized)) {
                return platform;
            }
        }
        throw new IllegalArgumentException("'" + value + "' is not a known platform");
    }

    /**
     * Platform of the running JVM, derived from {@code os.name} and {@code os.arch}.
     */
    public static Platform current() {
        return detect(System.getProperty("os.name", ""), System.getProperty("os.arch", ""));
    }

    static Platform detect(String osName, String osArch) {
        String os = osName.toLowerCase(Locale.ROOT);
        String arch = osArch.toLowerCase(Locale.ROOT);
        boolean arm64 = arch.equals("aarch64") || arch.equals("arm64");
        if (os.startsWith("windows")) {
            if (arm64) {
                return WIN_ARM64;
            }
            return arch.equals("x86") ? WIN_32 : WIN_64;
        }
        if (os.startsWith("mac") || os.startsWith("darwin")) {
            return arm64 ? OSX_ARM64 : OSX_64;
        }
        if (os.startsWith("linux")) {
            switch (arch) {
                case "aarch64":
                case "arm64":
                    return LINUX_AARCH64;
                case "ppc64le":
                    return LINUX_PPC64LE;
                case "s390x":
                    return LINUX_S390X;
                case "riscv64":
                    return LINUX_RISCV64;
                case "arm":
                    return LINUX_ARMV7L;
                case "x86":
                case "i386":
                    return LINUX_32;
                default:
                    return LINUX_64;
            }
        }
        throw new IllegalStateException("Unsupported host operating system: " + osName + " (" + osArch + ")");
    }

    @Override
    public String toString() {
        return subdir;
    }
}
