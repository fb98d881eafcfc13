package work.lcod.buildbackend.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * What the frontend supports. No flags are defined yet; unknown ones are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FrontendCapabilities() {}
