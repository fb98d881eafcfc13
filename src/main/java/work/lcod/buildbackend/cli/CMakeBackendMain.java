package work.lcod.buildbackend.cli;

import work.lcod.buildbackend.backend.cmake.CMakeBuildBackendFactory;

/**
 * Entry point of the CMake build backend.
 */
public final class CMakeBackendMain {
    private CMakeBackendMain() {}

    public static void main(String[] args) {
        System.exit(BackendCommand.execute("pixi-build-cmake", new CMakeBuildBackendFactory(), args));
    }
}
