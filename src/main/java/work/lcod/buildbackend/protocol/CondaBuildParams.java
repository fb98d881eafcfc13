package work.lcod.buildbackend.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import work.lcod.buildbackend.conda.GenericVirtualPackage;

/**
 * @param outputs restricts the build to matching outputs; everything is built when absent
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CondaBuildParams(
    List<GenericVirtualPackage> buildPlatformVirtualPackages,
    PlatformAndVirtualPackages hostPlatform,
    List<URI> channelBaseUrls,
    ChannelConfiguration channelConfiguration,
    List<CondaOutputIdentifier> outputs,
    @JsonSerialize(using = ToStringSerializer.class) Path workDirectory
) {}
