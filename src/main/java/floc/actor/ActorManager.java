package floc.actor;

import akka.actor.ActorRef;
import akka.actor.ActorSystem;
import akka.pattern.AskTimeoutException;
import akka.pattern.Patterns;
import akka.routing.RoundRobinPool;
import floc.lp.LinearSolver;
import floc.solver.ScenarioSubproblem;
import floc.solver.SubproblemResult;
import floc.utility.Constants;
import floc.utility.OptException;
import floc.utility.SolverTimeoutException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public class ActorManager {
    private final static Logger logger = LogManager.getLogger(ActorManager.class);
    private final static Duration ASK_SLACK = Duration.ofSeconds(5);
    private final static Duration UNLIMITED_ASK = Duration.ofDays(1);
    private final ActorSystem actorSystem;
    private ActorRef router;

    public ActorManager() {
        actorSystem = ActorSystem.create("benders");
    }

    public final void createActors(int numThreads, LinearSolver solver) {
        router = actorSystem.actorOf(
            new RoundRobinPool(numThreads).props(SubproblemActor.props(solver)));
    }

    /**
     * Dispatches every subproblem to the actor pool and waits for all replies.
     *
     * @return results in the order of the given subproblems.
     */
    public final SubproblemResult[] solveModels(ScenarioSubproblem[] models, long timeLimitInMillis)
            throws OptException {
        final Duration askTimeout = timeLimitInMillis > Constants.NO_TIME_LIMIT
            ? Duration.ofMillis(timeLimitInMillis).plus(ASK_SLACK)
            : UNLIMITED_ASK;

        ArrayList<CompletableFuture<Object>> futures = new ArrayList<>();
        for (ScenarioSubproblem model : models)
            futures.add(Patterns.ask(router, new SubproblemActor.SolveSubproblem(model, timeLimitInMillis),
                askTimeout).toCompletableFuture());

        SubproblemResult[] results = new SubproblemResult[models.length];
        for (int k = 0; k < futures.size(); ++k) {
            try {
                results[k] = (SubproblemResult) futures.get(k).get();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                logger.error(ex);
                throw new OptException("interruption when waiting for 2nd stage solution", ex);
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause();
                if (cause instanceof CompletionException && cause.getCause() != null)
                    cause = cause.getCause();
                if (cause instanceof OptException)
                    throw (OptException) cause;
                if (cause instanceof AskTimeoutException)
                    throw new SolverTimeoutException("no reply from scenario " + models[k].getScenario().getId()
                        + " within " + askTimeout.toMillis() + " ms");
                logger.error(cause);
                throw new OptException("error solving scenario " + models[k].getScenario().getId(), cause);
            }
        }
        return results;
    }

    public void end() {
        actorSystem.terminate();
    }
}
