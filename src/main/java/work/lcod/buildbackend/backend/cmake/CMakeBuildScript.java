package work.lcod.buildbackend.backend.cmake;

import java.nio.file.Path;
import java.util.List;

/**
 * Configure, build and install commands for a CMake project built with Ninja.
 */
public final class CMakeBuildScript {
    private CMakeBuildScript() {}

    public static List<String> render(Path sourceDir, boolean windows) {
        if (windows) {
            return List.of(
                "cmake %CMAKE_ARGS% -GNinja -DCMAKE_BUILD_TYPE=Release -DCMAKE_INSTALL_PREFIX=%LIBRARY_PREFIX% "
                    + "-DBUILD_SHARED_LIBS=ON -B %SRC_DIR%\\..\\build -S \"" + sourceDir + "\"",
                "if errorlevel 1 exit 1",
                "cmake --build %SRC_DIR%\\..\\build --target install",
                "if errorlevel 1 exit 1"
            );
        }
        return List.of(
            "cmake $CMAKE_ARGS -GNinja -DCMAKE_BUILD_TYPE=Release -DCMAKE_INSTALL_PREFIX=$PREFIX "
                + "-DBUILD_SHARED_LIBS=ON -B $SRC_DIR/../build -S \"" + sourceDir + "\"",
            "cmake --build $SRC_DIR/../build --target install"
        );
    }
}
