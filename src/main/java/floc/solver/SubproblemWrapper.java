package floc.solver;

import floc.actor.ActorManager;
import floc.domain.Scenario;
import floc.lp.LinearSolver;
import floc.registry.ModelData;
import floc.utility.OptException;

import java.util.List;

/**
 * Wrapper class that can be used to solve the second-stage problems in parallel.
 */
class SubproblemWrapper {
    private static ActorManager actorManager;
    private final ModelData modelData;
    private final boolean[] openFacilities; // open decision from the first stage solution.

    SubproblemWrapper(ModelData modelData, boolean[] openFacilities) {
        this.modelData = modelData;
        this.openFacilities = openFacilities;
    }

    SubproblemResult[] solveSequential(LinearSolver solver, long timeLimitInMillis) throws OptException {
        ScenarioSubproblem[] models = buildModels();
        SubproblemResult[] results = new SubproblemResult[models.length];
        for (int s = 0; s < models.length; ++s)
            results[s] = models[s].solve(solver, timeLimitInMillis);
        return results;
    }

    SubproblemResult[] solveParallel(long timeLimitInMillis) throws OptException {
        return actorManager.solveModels(buildModels(), timeLimitInMillis);
    }

    private ScenarioSubproblem[] buildModels() {
        List<Scenario> scenarios = modelData.getScenarios();
        ScenarioSubproblem[] models = new ScenarioSubproblem[scenarios.size()];
        for (Scenario scenario : scenarios)
            models[scenario.getIndex()] = new ScenarioSubproblem(modelData, scenario, openFacilities);
        return models;
    }

    static void initActorManager(LinearSolver solver, int numThreads) {
        actorManager = new ActorManager();
        actorManager.createActors(numThreads, solver);
    }

    static void clearActorManager() {
        actorManager.end();
        actorManager = null;
    }
}
