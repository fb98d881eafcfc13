package work.lcod.buildbackend.cli;

import work.lcod.buildbackend.backend.python.PythonBuildBackendFactory;

/**
 * Entry point of the Python build backend.
 */
public final class PythonBackendMain {
    private PythonBackendMain() {}

    public static void main(String[] args) {
        System.exit(BackendCommand.execute("pixi-build-python", new PythonBuildBackendFactory(), args));
    }
}
