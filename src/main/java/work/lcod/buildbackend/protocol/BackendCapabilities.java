package work.lcod.buildbackend.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BackendCapabilities(Boolean providesCondaMetadata, Boolean providesCondaBuild) {}
