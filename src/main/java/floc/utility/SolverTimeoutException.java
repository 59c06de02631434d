package floc.utility;

/**
 * Thrown when a solve call hits its time limit before proving optimality. Recoverable: the Benders loop
 * stops and returns the best incumbent.
 */
public class SolverTimeoutException extends OptException {
    public SolverTimeoutException(String message) {
        super(message);
    }
}
