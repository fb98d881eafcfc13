package work.lcod.buildbackend.recipe;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.buildbackend.conda.MatchSpec;
import work.lcod.buildbackend.conda.NoArchType;
import work.lcod.buildbackend.conda.Version;

class RecipeRendererTest {
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    @Test
    void rendersRattlerBuildLayout() throws Exception {
        var recipe = new Recipe(
            "demo",
            Version.parse("0dev0"),
            List.of(new Source.PathSource(Path.of("/work/demo"), true)),
            new BuildSection(0, List.of("$PYTHON -m pip install ."), NoArchType.PYTHON),
            new Requirements(List.of(), List.of(MatchSpec.of("pip"), MatchSpec.of("python")), List.of(MatchSpec.parse("numpy >=1.0"))),
            new About(Optional.of("MIT"), Optional.empty(), Optional.empty(),
                Optional.empty(), Optional.of("demo package"))
        );
        JsonNode tree = YAML.readTree(RecipeRenderer.render(recipe));

        assertEquals(1, tree.path("schema_version").asInt());
        assertEquals("demo", tree.path("package").path("name").asText());
        assertEquals("0dev0", tree.path("package").path("version").asText());
        assertTrue(tree.path("source").get(0).path("use_gitignore").asBoolean());
        assertEquals("python", tree.path("build").path("noarch").asText());
        assertEquals("$PYTHON -m pip install .", tree.path("build").path("script").get(0).asText());
        assertFalse(tree.path("requirements").has("build"));
        assertEquals("pip", tree.path("requirements").path("host").get(0).asText());
        assertEquals("numpy >=1.0", tree.path("requirements").path("run").get(0).asText());
        assertEquals("MIT", tree.path("about").path("license").asText());
        assertEquals("demo package", tree.path("about").path("summary").asText());
    }

    @Test
    void omitsNoarchForNativePackages() throws Exception {
        var recipe = new Recipe(
            "native",
            Version.parse("1.10"),
            List.of(),
            new BuildSection(0, List.of("cmake --build ."), NoArchType.NONE),
            new Requirements(List.of(), List.of(), List.of()),
            About.empty()
        );
        JsonNode tree = YAML.readTree(RecipeRenderer.render(recipe));
        assertEquals("1.10", tree.path("package").path("version").asText());
        assertFalse(tree.path("build").has("noarch"));
        assertFalse(tree.has("source"));
        assertFalse(tree.has("about"));
    }
}
