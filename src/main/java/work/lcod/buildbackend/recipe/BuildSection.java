package work.lcod.buildbackend.recipe;

import java.util.List;
import java.util.Objects;
import work.lcod.buildbackend.conda.NoArchType;

/**
 * Build number, ordered script commands and noarch classification of a recipe.
 */
public record BuildSection(int number, List<String> script, NoArchType noarch) {
    public BuildSection {
        if (number < 0) {
            throw new IllegalArgumentException("build number must not be negative");
        }
        script = List.copyOf(script);
        Objects.requireNonNull(noarch, "noarch");
    }
}
