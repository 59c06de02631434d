package floc.actor;

import akka.actor.AbstractActor;
import akka.actor.Props;
import akka.actor.Status;
import floc.lp.LinearSolver;
import floc.solver.ScenarioSubproblem;
import floc.solver.SubproblemResult;
import floc.utility.OptException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class SubproblemActor extends AbstractActor {
    private final static Logger logger = LogManager.getLogger(SubproblemActor.class);
    private final LinearSolver solver;

    private SubproblemActor(LinearSolver solver) {
        this.solver = solver;
    }

    static Props props(LinearSolver solver) {
        return Props.create(SubproblemActor.class, () -> new SubproblemActor(solver));
    }

    // SubproblemActor messages
    static class SolveSubproblem {
        private final ScenarioSubproblem subproblem;
        private final long timeLimitInMillis;

        SolveSubproblem(ScenarioSubproblem subproblem, long timeLimitInMillis) {
            this.subproblem = subproblem;
            this.timeLimitInMillis = timeLimitInMillis;
        }
    }

    @Override
    public Receive createReceive() {
        return receiveBuilder()
            .match(SolveSubproblem.class, this::handle)
            .build();
    }

    private void handle(SolveSubproblem solveSubproblem) {
        ScenarioSubproblem subproblem = solveSubproblem.subproblem;
        try {
            SubproblemResult result = subproblem.solve(solver, solveSubproblem.timeLimitInMillis);
            getSender().tell(result, getSelf());
        } catch (OptException ex) {
            logger.debug("scenario " + subproblem.getScenario().getId() + " failed: " + ex.getMessage());
            getSender().tell(new Status.Failure(ex), getSelf());
        } catch (RuntimeException ex) {
            logger.error("scenario " + subproblem.getScenario().getId() + " crashed", ex);
            getSender().tell(new Status.Failure(ex), getSelf());
        }
    }
}
