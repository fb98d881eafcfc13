package work.lcod.buildbackend.backend.python;

import java.util.Objects;
import java.util.Optional;
import work.lcod.buildbackend.engine.BuildEngine;
import work.lcod.buildbackend.engine.RattlerBuildEngine;
import work.lcod.buildbackend.manifest.ManifestLoader;
import work.lcod.buildbackend.manifest.ProjectManifest;
import work.lcod.buildbackend.protocol.Initialized;
import work.lcod.buildbackend.protocol.InitializeParams;
import work.lcod.buildbackend.protocol.InitializeResult;
import work.lcod.buildbackend.protocol.ProtocolFactory;
import work.lcod.buildbackend.shared.BackendException;

public final class PythonBuildBackendFactory implements ProtocolFactory<PythonBuildBackend> {
    private final BuildEngine engine;

    public PythonBuildBackendFactory() {
        this(RattlerBuildEngine.fromEnvironment());
    }

    public PythonBuildBackendFactory(BuildEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    @Override
    public Initialized<PythonBuildBackend> initialize(InitializeParams params) {
        ProjectManifest manifest = ManifestLoader.load(params.manifestPath());
        if (manifest.name().isEmpty()) {
            throw BackendException.configuration("a 'name' field is required in the project manifest");
        }
        var backend = new PythonBuildBackend(manifest, engine, Optional.ofNullable(params.cacheDirectory()));
        return new Initialized<>(backend, new InitializeResult(backend.capabilities(params.capabilities())));
    }
}
