package work.lcod.buildbackend.protocol;

/**
 * Thrown when a backend is asked for a procedure it does not implement.
 */
public class UnsupportedProcedureException extends RuntimeException {
    private final String procedure;

    public UnsupportedProcedureException(String procedure) {
        super("procedure '" + procedure + "' is not supported by this backend");
        this.procedure = procedure;
    }

    public String procedure() {
        return procedure;
    }
}
