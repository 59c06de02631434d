package floc.lp;

import floc.utility.Enums;
import floc.utility.SolverFailureException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RetryingSolverTests {
    /**
     * Fails the given number of calls, then reports an optimal empty solution.
     */
    private static class FlakySolver implements LinearSolver {
        private int failuresLeft;
        private int numCalls;

        FlakySolver(int failures) {
            failuresLeft = failures;
        }

        @Override
        public SolveOutcome solve(LinearProgram program) throws SolverFailureException {
            ++numCalls;
            if (failuresLeft > 0) {
                --failuresLeft;
                throw new SolverFailureException("backend crashed");
            }
            return new SolveOutcome(Enums.SolveStatus.OPTIMAL, 0.0, 0.0, new double[0], new double[0]);
        }
    }

    @Test
    @DisplayName("a single failure should be retried transparently")
    void testRetry() throws Exception {
        FlakySolver flaky = new FlakySolver(1);
        SolveOutcome outcome = new RetryingSolver(flaky).solve(new LinearProgram("p"));
        assertTrue(outcome.isOptimal());
        assertEquals(2, flaky.numCalls);
    }

    @Test
    @DisplayName("a repeated failure should be propagated after one retry")
    void testRepeatedFailure() {
        FlakySolver flaky = new FlakySolver(2);
        assertThrows(SolverFailureException.class, () -> new RetryingSolver(flaky).solve(new LinearProgram("p")));
        assertEquals(2, flaky.numCalls);
    }

    @Test
    @DisplayName("legitimate statuses should not be retried")
    void testNoRetryOnStatus() throws Exception {
        final int[] calls = {0};
        LinearSolver infeasible = program -> {
            ++calls[0];
            return SolveOutcome.withoutSolution(Enums.SolveStatus.INFEASIBLE);
        };
        SolveOutcome outcome = new RetryingSolver(infeasible).solve(new LinearProgram("p"));
        assertEquals(Enums.SolveStatus.INFEASIBLE, outcome.getStatus());
        assertEquals(1, calls[0]);
    }
}
