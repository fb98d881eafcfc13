package work.lcod.buildbackend.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import work.lcod.buildbackend.conda.Platform;

/**
 * Selects an output to build. Absent fields match anything.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CondaOutputIdentifier(String name, String version, String build, Platform subdir) {}
