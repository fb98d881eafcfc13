package work.lcod.buildbackend.backend.cmake;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.lcod.buildbackend.shared.BackendException;

/**
 * Reads the languages of a CMake project from the {@code project()} call of its
 * {@code CMakeLists.txt}.
 */
public final class CMakeLanguages {
    private static final Pattern PROJECT_CALL = Pattern.compile("(?is)\\bproject\\s*\\(([^)]*)\\)");
    private static final List<String> KEYWORDS = List.of("VERSION", "DESCRIPTION", "HOMEPAGE_URL", "LANGUAGES");
    /** Used when the project root has no CMakeLists.txt. */
    static final List<String> WITHOUT_LISTS_FILE = List.of("cxx");
    /** CMake enables C and C++ when project() names no languages. */
    static final List<String> CMAKE_DEFAULT = List.of("c", "cxx");

    private CMakeLanguages() {}

    public static List<String> detect(Path projectRoot) {
        Path lists = projectRoot.resolve("CMakeLists.txt");
        if (!Files.isRegularFile(lists)) {
            return WITHOUT_LISTS_FILE;
        }
        try {
            return parse(Files.readString(lists));
        } catch (IOException ex) {
            throw BackendException.configuration("failed to read " + lists, ex);
        }
    }

    static List<String> parse(String content) {
        Matcher matcher = PROJECT_CALL.matcher(stripComments(content));
        if (!matcher.find()) {
            return CMAKE_DEFAULT;
        }
        String[] args = matcher.group(1).trim().split("\\s+");
        List<String> languages = new ArrayList<>();
        boolean inLanguages = false;
        // the first argument is the project name; bare words after it are languages too
        boolean positional = true;
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            String upper = arg.toUpperCase(Locale.ROOT);
            if (KEYWORDS.contains(upper)) {
                inLanguages = upper.equals("LANGUAGES");
                positional = false;
                if (!inLanguages) {
                    i++;
                }
                continue;
            }
            if (inLanguages || positional) {
                languages.add(toCondaLanguage(upper));
            }
        }
        if (languages.isEmpty()) {
            return CMAKE_DEFAULT;
        }
        if (languages.contains("none")) {
            return List.of();
        }
        return List.copyOf(languages);
    }

    private static String toCondaLanguage(String cmakeLanguage) {
        switch (cmakeLanguage) {
            case "CXX":
                return "cxx";
            case "C":
                return "c";
            case "FORTRAN":
                return "fortran";
            case "CUDA":
                return "cuda";
            default:
                return cmakeLanguage.toLowerCase(Locale.ROOT);
        }
    }

    private static String stripComments(String content) {
        return content.replaceAll("(?m)#.*$", "");
    }
}
