package work.lcod.buildbackend.recipe;

import java.util.Map;
import java.util.Optional;
import work.lcod.buildbackend.conda.MatchSpec;
import work.lcod.buildbackend.conda.Platform;

/**
 * Default compiler packages per platform and source language.
 */
public final class Compilers {
    private static final Map<String, String> WINDOWS = Map.of("c", "vs2017", "cxx", "vs2017");
    private static final Map<String, String> OSX = Map.of("c", "clang", "cxx", "clangxx");
    private static final Map<String, String> EMSCRIPTEN = Map.of("c", "emscripten", "cxx", "emscripten");
    private static final Map<String, String> UNIX = Map.of("c", "gcc", "cxx", "gxx");
    private static final Map<String, String> PLATFORM_AGNOSTIC = Map.of("fortran", "gfortran");

    private Compilers() {}

    /**
     * Name of the compiler for {@code language} on {@code platform}. C and C++ map to the
     * platform toolchain, Fortran to gfortran, any other language is passed through unchanged.
     */
    public static Optional<String> defaultCompiler(Platform platform, String language) {
        if (language == null || language.isBlank()) {
            return Optional.empty();
        }
        String lang = language.trim();
        String agnostic = PLATFORM_AGNOSTIC.get(lang);
        if (agnostic != null) {
            return Optional.of(agnostic);
        }
        if (!UNIX.containsKey(lang)) {
            return Optional.of(lang);
        }
        return Optional.of(tableFor(platform).get(lang));
    }

    /**
     * Match spec of the compiler package, named {@code <compiler>_<platform>}.
     */
    public static Optional<MatchSpec> compilerPackage(Platform platform, String language) {
        return defaultCompiler(platform, language).map(name -> MatchSpec.of(name + "_" + platform.subdir()));
    }

    private static Map<String, String> tableFor(Platform platform) {
        if (platform.isWindows()) {
            return WINDOWS;
        }
        if (platform.isOsx()) {
            return OSX;
        }
        if (platform == Platform.EMSCRIPTEN_WASM32) {
            return EMSCRIPTEN;
        }
        return UNIX;
    }
}
