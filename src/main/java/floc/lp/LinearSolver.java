package floc.lp;

import floc.utility.SolverFailureException;

/**
 * Generic LP/MIP solve primitive used by the master problem, the scenario subproblems and the
 * deterministic equivalent. Implementations must be safe to call from several threads at once.
 */
public interface LinearSolver {
    /**
     * Solves the program as a minimization.
     *
     * @param program problem to solve, left unchanged.
     * @return outcome with status OPTIMAL, INFEASIBLE, UNBOUNDED or TIMEOUT.
     * @throws SolverFailureException if the backend crashes, is unavailable or rejects the model.
     */
    SolveOutcome solve(LinearProgram program) throws SolverFailureException;
}
