package work.lcod.buildbackend.protocol;

/**
 * Procedures an initialized backend can serve. Backends override what they support; the
 * defaults reject the call.
 */
public interface Protocol {
    default CondaMetadataResult getCondaMetadata(CondaMetadataParams params) {
        throw new UnsupportedProcedureException(Procedures.CONDA_METADATA);
    }

    default CondaBuildResult buildConda(CondaBuildParams params) {
        throw new UnsupportedProcedureException(Procedures.CONDA_BUILD);
    }
}
