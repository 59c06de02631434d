package floc.utility;

public class Enums {

    /**
     * Model specifies the solution approach used by the controller.
     * <p>
     * BENDERS: multi-cut Benders decomposition.
     * DEP: deterministic equivalent (extensive form) solved as a single MIP.
     */
    public enum Model {BENDERS, DEP}

    /**
     * DistributionType specifies the probability distribution to use for sampling customer demands.
     */
    public enum DistributionType {TRUNCATED_NORMAL, LOG_NORMAL, EXPONENTIAL}

    public enum CutType {OPTIMALITY, FEASIBILITY}

    /**
     * Status reported by the solve capability.
     */
    public enum SolveStatus {OPTIMAL, INFEASIBLE, UNBOUNDED, TIMEOUT}

    /**
     * BendersState tracks the control loop.
     * <p>
     * INIT: nothing solved yet.
     * ITERATING: master and scenario solves in progress.
     * CONVERGED: gap closed within tolerance, or no cut was added in the last iteration.
     * MAX_ITER_REACHED: iteration limit hit, best incumbent returned.
     * TIME_LIMIT_REACHED: wall-clock budget spent, best incumbent returned.
     * INFEASIBLE_MODEL: no open set satisfies the first-stage constraints.
     */
    public enum BendersState {INIT, ITERATING, CONVERGED, MAX_ITER_REACHED, TIME_LIMIT_REACHED, INFEASIBLE_MODEL}
}
