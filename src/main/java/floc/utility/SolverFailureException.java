package floc.utility;

/**
 * Thrown when a solve call fails for a reason other than a legitimate infeasible/unbounded status,
 * e.g. an unavailable backend or a malformed model.
 */
public class SolverFailureException extends OptException {
    public SolverFailureException(String message) {
        super(message);
    }

    public SolverFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
