package work.lcod.buildbackend.conda;

import java.net.URI;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Resolves channel names and relative channel paths to base URLs.
 *
 * @param channelAlias base URL prefixed to bare channel names such as {@code conda-forge}
 * @param rootDir directory relative channel paths (and path dependencies) are resolved against
 */
public record ChannelConfig(URI channelAlias, Path rootDir) {
    public static final URI DEFAULT_CHANNEL_ALIAS = URI.create("https://conda.anaconda.org/");

    public ChannelConfig {
        Objects.requireNonNull(rootDir, "rootDir");
        channelAlias = withTrailingSlash(channelAlias == null ? DEFAULT_CHANNEL_ALIAS : channelAlias);
        rootDir = rootDir.toAbsolutePath().normalize();
    }

    public static ChannelConfig defaultWithRootDir(Path rootDir) {
        return new ChannelConfig(DEFAULT_CHANNEL_ALIAS, rootDir);
    }

    /**
     * Returns the base URL of a channel given by name, URL or path.
     */
    public URI resolveChannel(String channel) {
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel must not be empty");
        }
        String value = channel.trim();
        if (value.contains("://")) {
            return withTrailingSlash(URI.create(value));
        }
        if (isPathLike(value)) {
            return withTrailingSlash(rootDir.resolve(expandHome(value)).normalize().toUri());
        }
        if (value.contains(" ") || value.startsWith("/")) {
            throw new IllegalArgumentException("'" + channel + "' is not a valid channel");
        }
        return channelAlias.resolve(value + "/");
    }

    /**
     * Resolves a path as written in the manifest against the root directory.
     */
    public Path resolvePath(String path) {
        return rootDir.resolve(expandHome(path)).toAbsolutePath().normalize();
    }

    private static boolean isPathLike(String value) {
        return value.startsWith("/")
            || value.startsWith("./")
            || value.startsWith("../")
            || value.startsWith("~")
            || value.equals(".")
            || value.equals("..")
            || (value.length() > 2 && value.charAt(1) == ':' && (value.charAt(2) == '\\' || value.charAt(2) == '/'));
    }

    private static String expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return System.getProperty("user.home") + path.substring(1);
        }
        return path;
    }

    private static URI withTrailingSlash(URI uri) {
        String text = uri.toString();
        return text.endsWith("/") ? uri : URI.create(text + "/");
    }
}
