package work.lcod.buildbackend.recipe;

import java.util.List;
import java.util.Objects;
import work.lcod.buildbackend.conda.NoArchType;

/**
 * The ecosystem specific parts of a recipe: noarch classification, sources, build script and
 * the languages that need a compiler.
 *
 * @param ignoreSelf skip path dependencies pointing at the project itself instead of rejecting them
 */
public record RecipeTemplate(
    NoArchType noarch,
    List<Source> sources,
    List<String> script,
    List<String> compilerLanguages,
    boolean ignoreSelf
) {
    public RecipeTemplate {
        Objects.requireNonNull(noarch, "noarch");
        sources = List.copyOf(sources);
        script = List.copyOf(script);
        compilerLanguages = List.copyOf(compilerLanguages);
    }
}
