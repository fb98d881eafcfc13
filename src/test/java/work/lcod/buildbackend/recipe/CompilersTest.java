package work.lcod.buildbackend.recipe;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.buildbackend.conda.Platform;

class CompilersTest {
    @Test
    void picksToolchainPerPlatform() {
        assertEquals(Optional.of("gxx"), Compilers.defaultCompiler(Platform.LINUX_64, "cxx"));
        assertEquals(Optional.of("gcc"), Compilers.defaultCompiler(Platform.LINUX_AARCH64, "c"));
        assertEquals(Optional.of("clangxx"), Compilers.defaultCompiler(Platform.OSX_ARM64, "cxx"));
        assertEquals(Optional.of("clang"), Compilers.defaultCompiler(Platform.OSX_64, "c"));
        assertEquals(Optional.of("vs2017"), Compilers.defaultCompiler(Platform.WIN_64, "cxx"));
        assertEquals(Optional.of("emscripten"), Compilers.defaultCompiler(Platform.EMSCRIPTEN_WASM32, "c"));
    }

    @Test
    void otherLanguagesAreMappedOrPassedThrough() {
        assertEquals(Optional.of("gfortran"), Compilers.defaultCompiler(Platform.WIN_64, "fortran"));
        assertEquals(Optional.of("rust"), Compilers.defaultCompiler(Platform.LINUX_64, "rust"));
        assertTrue(Compilers.defaultCompiler(Platform.LINUX_64, " ").isEmpty());
    }

    @Test
    void compilerPackageCarriesThePlatform() {
        assertEquals("gxx_linux-64", Compilers.compilerPackage(Platform.LINUX_64, "cxx").orElseThrow().name());
        assertEquals("vs2017_win-64", Compilers.compilerPackage(Platform.WIN_64, "c").orElseThrow().toString());
    }
}
