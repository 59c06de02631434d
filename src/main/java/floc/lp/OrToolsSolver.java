package floc.lp;

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPSolverParameters;
import com.google.ortools.linearsolver.MPVariable;
import floc.utility.Constants;
import floc.utility.Enums;
import floc.utility.SolverFailureException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;

/**
 * Solve capability backed by the OR-Tools linear solver wrapper. Continuous programs go to the LP backend
 * (GLOP by default), programs with integer columns to the MIP backend (SCIP by default). Every call builds
 * its own {@link MPSolver}, so one instance can serve several threads.
 */
public class OrToolsSolver implements LinearSolver {
    private final static Logger logger = LogManager.getLogger(OrToolsSolver.class);

    static {
        Loader.loadNativeLibraries();
    }

    private final String lpSolverId;
    private final String mipSolverId;
    private final double relativeMipGap;

    public OrToolsSolver(String lpSolverId, String mipSolverId) {
        this(lpSolverId, mipSolverId, Constants.MIP_GAP);
    }

    public OrToolsSolver(String lpSolverId, String mipSolverId, double relativeMipGap) {
        this.lpSolverId = lpSolverId;
        this.mipSolverId = mipSolverId;
        this.relativeMipGap = relativeMipGap;
    }

    @Override
    public SolveOutcome solve(LinearProgram program) throws SolverFailureException {
        final boolean isMip = program.isMip();
        final String solverId = isMip ? mipSolverId : lpSolverId;
        MPSolver solver = MPSolver.createSolver(solverId);
        if (solver == null)
            throw new SolverFailureException("OR-Tools backend " + solverId + " is not available");

        try {
            List<LpVariable> variables = program.getVariables();
            MPVariable[] mpVariables = new MPVariable[variables.size()];
            MPObjective objective = solver.objective();
            for (LpVariable variable : variables) {
                MPVariable mpVariable = solver.makeVar(variable.getLowerBound(), variable.getUpperBound(),
                    variable.isInteger(), variable.getName());
                mpVariables[variable.getIndex()] = mpVariable;
                if (variable.getObjectiveCoef() != 0.0)
                    objective.setCoefficient(mpVariable, variable.getObjectiveCoef());
            }
            objective.setMinimization();

            List<LpConstraint> constraints = program.getConstraints();
            MPConstraint[] mpConstraints = new MPConstraint[constraints.size()];
            for (LpConstraint constraint : constraints) {
                MPConstraint mpConstraint = solver.makeConstraint(constraint.getLowerBound(),
                    constraint.getUpperBound(), constraint.getName());
                for (Map.Entry<LpVariable, Double> term : constraint.getTerms().entrySet())
                    mpConstraint.setCoefficient(mpVariables[term.getKey().getIndex()], term.getValue());
                mpConstraints[constraint.getIndex()] = mpConstraint;
            }

            final long timeLimit = program.getTimeLimitInMillis();
            if (timeLimit > Constants.NO_TIME_LIMIT)
                solver.setTimeLimit(timeLimit);

            MPSolverParameters solverParameters = new MPSolverParameters();
            if (isMip)
                solverParameters.setDoubleParam(MPSolverParameters.DoubleParam.RELATIVE_MIP_GAP, relativeMipGap);

            logger.debug("solving " + program.getName() + " with " + solverId + ": "
                + program.getNumVariables() + " columns, " + program.getNumConstraints() + " rows");
            MPSolver.ResultStatus resultStatus = solver.solve(solverParameters);
            logger.debug(program.getName() + " status: " + resultStatus);

            switch (resultStatus) {
                case OPTIMAL:
                    return collectOutcome(Enums.SolveStatus.OPTIMAL, isMip, objective, mpVariables, mpConstraints);
                case FEASIBLE:
                    // only reported when a limit stopped the search before optimality was proven.
                    return collectOutcome(Enums.SolveStatus.TIMEOUT, isMip, objective, mpVariables, null);
                case INFEASIBLE:
                    return SolveOutcome.withoutSolution(Enums.SolveStatus.INFEASIBLE);
                case UNBOUNDED:
                    return SolveOutcome.withoutSolution(Enums.SolveStatus.UNBOUNDED);
                case NOT_SOLVED:
                    if (timeLimit > Constants.NO_TIME_LIMIT)
                        return SolveOutcome.withoutSolution(Enums.SolveStatus.TIMEOUT);
                    throw new SolverFailureException(program.getName() + " was not solved by " + solverId);
                default:
                    throw new SolverFailureException(solverId + " returned " + resultStatus + " for "
                        + program.getName());
            }
        } catch (RuntimeException ex) {
            logger.error(ex);
            throw new SolverFailureException("OR-Tools error solving " + program.getName(), ex);
        } finally {
            solver.delete();
        }
    }

    private static SolveOutcome collectOutcome(Enums.SolveStatus status, boolean isMip, MPObjective objective,
                                               MPVariable[] mpVariables, MPConstraint[] mpConstraints) {
        double[] values = new double[mpVariables.length];
        for (int i = 0; i < mpVariables.length; ++i)
            values[i] = mpVariables[i].solutionValue();

        double[] duals = null;
        if (!isMip && mpConstraints != null) {
            duals = new double[mpConstraints.length];
            for (int i = 0; i < mpConstraints.length; ++i)
                duals[i] = mpConstraints[i].dualValue();
        }

        final double objectiveValue = objective.value();
        final double objectiveBound = isMip ? objective.bestBound() : objectiveValue;
        return new SolveOutcome(status, objectiveValue, objectiveBound, values, duals);
    }
}
