package work.lcod.buildbackend.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import java.nio.file.Path;

/**
 * @param manifestPath the project manifest the backend is built from
 * @param cacheDirectory optional directory the engine may use for caches
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InitializeParams(
    @JsonSerialize(using = ToStringSerializer.class) Path manifestPath,
    FrontendCapabilities capabilities,
    @JsonSerialize(using = ToStringSerializer.class) Path cacheDirectory
) {
    public InitializeParams {
        capabilities = capabilities == null ? new FrontendCapabilities() : capabilities;
    }
}
