package work.lcod.buildbackend.protocol;

import java.util.List;

public record CondaBuildResult(List<CondaBuiltPackage> packages) {}
