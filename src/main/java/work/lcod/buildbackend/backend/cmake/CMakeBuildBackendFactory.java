package work.lcod.buildbackend.backend.cmake;

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

public final class CMakeBuildBackendFactory implements ProtocolFactory<CMakeBuildBackend> {
    private final BuildEngine engine;

    public CMakeBuildBackendFactory() {
        this(RattlerBuildEngine.fromEnvironment());
    }

    public CMakeBuildBackendFactory(BuildEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    @Override
    public Initialized<CMakeBuildBackend> initialize(InitializeParams params) {
        ProjectManifest manifest = ManifestLoader.load(params.manifestPath());
        if (manifest.name().isEmpty()) {
            throw BackendException.configuration("a 'name' field is required in the project manifest");
        }
        var backend = new CMakeBuildBackend(manifest, engine, Optional.ofNullable(params.cacheDirectory()));
        return new Initialized<>(backend, new InitializeResult(backend.capabilities(params.capabilities())));
    }
}
