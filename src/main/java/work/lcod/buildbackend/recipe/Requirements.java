package work.lcod.buildbackend.recipe;

import java.util.ArrayList;
import java.util.List;
import work.lcod.buildbackend.conda.MatchSpec;

public record Requirements(List<MatchSpec> build, List<MatchSpec> host, List<MatchSpec> run) {
    public Requirements {
        build = List.copyOf(build);
        host = List.copyOf(host);
        run = List.copyOf(run);
    }

    public Requirements withAdditionalBuild(List<MatchSpec> extra) {
        List<MatchSpec> combined = new ArrayList<>(build);
        combined.addAll(extra);
        return new Requirements(combined, host, run);
    }
}
