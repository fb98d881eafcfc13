package work.lcod.buildbackend.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import java.net.URI;
import java.nio.file.Path;
import java.util.List;

/**
 * @param channelBaseUrls replaces the manifest's channels when present
 * @param workDirectory where intermediate build files go; a temporary directory when absent
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CondaMetadataParams(
    PlatformAndVirtualPackages buildPlatform,
    PlatformAndVirtualPackages hostPlatform,
    List<URI> channelBaseUrls,
    ChannelConfiguration channelConfiguration,
    @JsonSerialize(using = ToStringSerializer.class) Path workDirectory
) {}
