package work.lcod.buildbackend.protocol;

public record InitializeResult(BackendCapabilities capabilities) {}
