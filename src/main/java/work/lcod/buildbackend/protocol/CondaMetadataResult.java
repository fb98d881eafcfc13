package work.lcod.buildbackend.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * @param inputGlobs files whose change invalidates the metadata
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CondaMetadataResult(List<CondaPackageMetadata> packages, List<String> inputGlobs) {}
