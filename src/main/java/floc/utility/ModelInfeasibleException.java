package floc.utility;

/**
 * Thrown when no open set can satisfy the first-stage constraints (aggregate capacity or accumulated
 * feasibility cuts). Never retried.
 */
public class ModelInfeasibleException extends OptException {
    public ModelInfeasibleException(String message) {
        super(message);
    }
}
