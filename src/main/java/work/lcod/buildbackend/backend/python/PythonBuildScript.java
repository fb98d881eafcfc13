package work.lcod.buildbackend.backend.python;

import java.util.ArrayList;
import java.util.List;

/**
 * Commands installing the project with the chosen installer.
 */
public final class PythonBuildScript {
    private static final String FLAGS = "-vv --no-deps --no-build-isolation .";

    private PythonBuildScript() {}

    public static List<String> render(Installer installer, boolean windows) {
        String python = windows ? "%PYTHON%" : "$PYTHON";
        String install = installer == Installer.UV
            ? "uv pip install --python " + python + " " + FLAGS
            : python + " -m pip install --ignore-installed " + FLAGS;
        List<String> lines = new ArrayList<>();
        lines.add(install);
        if (windows) {
            lines.add("if errorlevel 1 exit 1");
        }
        return List.copyOf(lines);
    }
}
