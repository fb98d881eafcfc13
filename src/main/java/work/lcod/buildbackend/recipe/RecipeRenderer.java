package work.lcod.buildbackend.recipe;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.buildbackend.conda.MatchSpec;

/**
 * Writes a {@link Recipe} in the YAML recipe format understood by rattler-build.
 */
public final class RecipeRenderer {
    private static final ObjectMapper YAML = new ObjectMapper(
        new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
    );

    private RecipeRenderer() {}

    public static String render(Recipe recipe) {
        try {
            return YAML.writeValueAsString(toTree(recipe));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("failed to render recipe for " + recipe.name(), ex);
        }
    }

    static Map<String, Object> toTree(Recipe recipe) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("schema_version", 1);
        Map<String, Object> pkg = new LinkedHashMap<>();
        pkg.put("name", recipe.name());
        pkg.put("version", recipe.version().toString());
        root.put("package", pkg);

        if (!recipe.sources().isEmpty()) {
            List<Map<String, Object>> sources = new ArrayList<>();
            for (Source source : recipe.sources()) {
                sources.add(source(source));
            }
            root.put("source", sources);
        }

        Map<String, Object> build = new LinkedHashMap<>();
        build.put("number", recipe.build().number());
        if (recipe.build().noarch().isNoArch()) {
            build.put("noarch", recipe.build().noarch().value());
        }
        build.put("script", recipe.build().script());
        root.put("build", build);

        Map<String, Object> requirements = new LinkedHashMap<>();
        putSpecs(requirements, "build", recipe.requirements().build());
        putSpecs(requirements, "host", recipe.requirements().host());
        putSpecs(requirements, "run", recipe.requirements().run());
        if (!requirements.isEmpty()) {
            root.put("requirements", requirements);
        }

        Map<String, Object> about = new LinkedHashMap<>();
        recipe.about().homepage().ifPresent(value -> about.put("homepage", value));
        recipe.about().repository().ifPresent(value -> about.put("repository", value));
        recipe.about().license().ifPresent(value -> about.put("license", value));
        recipe.about().licenseFamily().ifPresent(value -> about.put("license_family", value));
        recipe.about().summary().ifPresent(value -> about.put("summary", value));
        if (!about.isEmpty()) {
            root.put("about", about);
        }
        return root;
    }

    private static Map<String, Object> source(Source source) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (source instanceof Source.PathSource path) {
            out.put("path", path.path().toString());
            out.put("use_gitignore", path.useGitignore());
        } else if (source instanceof Source.GitSource git) {
            out.put("git", git.url().toString());
            git.revision().ifPresent(rev -> out.put("rev", rev));
        } else if (source instanceof Source.UrlSource url) {
            out.put("url", url.url().toString());
            url.checksum().ifPresent(sha -> out.put("sha256", sha));
        }
        return out;
    }

    private static void putSpecs(Map<String, Object> target, String key, List<MatchSpec> specs) {
        if (specs.isEmpty()) {
            return;
        }
        List<String> values = new ArrayList<>(specs.size());
        for (MatchSpec spec : specs) {
            values.add(spec.toString());
        }
        target.put(key, values);
    }
}
