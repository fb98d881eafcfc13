package work.lcod.buildbackend.conda;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PlatformTest {
    @Test
    void detectsFromJvmProperties() {
        assertEquals(Platform.LINUX_64, Platform.detect("Linux", "amd64"));
        assertEquals(Platform.LINUX_AARCH64, Platform.detect("Linux", "aarch64"));
        assertEquals(Platform.OSX_ARM64, Platform.detect("Mac OS X", "aarch64"));
        assertEquals(Platform.OSX_64, Platform.detect("Mac OS X", "x86_64"));
        assertEquals(Platform.WIN_64, Platform.detect("Windows 11", "amd64"));
    }

    @Test
    void parsesSubdirs() {
        assertEquals(Platform.WIN_64, Platform.parse("win-64"));
        assertEquals("noarch", Platform.NOARCH.toString());
        assertThrows(IllegalArgumentException.class, () -> Platform.parse("amiga-68k"));
    }

    @Test
    void classifiesFamilies() {
        assertTrue(Platform.LINUX_64.isUnix());
        assertTrue(Platform.OSX_64.isUnix());
        assertFalse(Platform.WIN_64.isUnix());
        assertFalse(Platform.NOARCH.isWindows());
    }

    @Test
    void overridesReplaceOrRemoveVirtualPackages() {
        List<GenericVirtualPackage> packages = VirtualPackages.detect(
            Platform.LINUX_64,
            Map.of("CONDA_OVERRIDE_GLIBC", "2.28", "CONDA_OVERRIDE_LINUX", "", "CONDA_OVERRIDE_CUDA", "12.0")
        );
        List<String> names = packages.stream().map(GenericVirtualPackage::name).toList();
        assertTrue(names.contains("__unix"));
        assertTrue(names.contains("__glibc"));
        assertTrue(names.contains("__cuda"));
        assertFalse(names.contains("__linux"));
        assertEquals(
            "__glibc=2.28=0",
            packages.stream().filter(p -> p.name().equals("__glibc")).findFirst().orElseThrow().toString()
        );
    }
}
