package work.lcod.buildbackend.protocol;

import java.net.URI;

/**
 * @param baseUrl channel alias prefixed to bare channel names
 */
public record ChannelConfiguration(URI baseUrl) {}
