package work.lcod.buildbackend.protocol;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import java.nio.file.Path;
import java.util.List;
import work.lcod.buildbackend.conda.Platform;

public record CondaBuiltPackage(
    @JsonSerialize(using = ToStringSerializer.class) Path outputFile,
    List<String> inputGlobs,
    String name,
    String version,
    String build,
    Platform subdir
) {}
