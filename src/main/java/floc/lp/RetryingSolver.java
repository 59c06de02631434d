package floc.lp;

import floc.utility.SolverFailureException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Decorator that repeats a failed solve call once before surfacing the failure. Legitimate statuses
 * (infeasible, unbounded, timeout) are returned as is.
 */
public class RetryingSolver implements LinearSolver {
    private final static Logger logger = LogManager.getLogger(RetryingSolver.class);
    private final LinearSolver delegate;

    public RetryingSolver(LinearSolver delegate) {
        this.delegate = delegate;
    }

    @Override
    public SolveOutcome solve(LinearProgram program) throws SolverFailureException {
        try {
            return delegate.solve(program);
        } catch (SolverFailureException ex) {
            logger.warn("solve of " + program.getName() + " failed (" + ex.getMessage() + "), retrying once");
        }
        return delegate.solve(program);
    }
}
