package floc.registry;

import floc.utility.Enums;

import java.util.HashMap;

public class Parameters {
    private static String instancePath;
    private static String outputPath;
    private static String outputName;
    private static Enums.Model model;

    // Solve capability backends
    private static String lpSolverId;
    private static String mipSolverId;

    // Benders parameters
    private static double cutTolerance; // theta must undershoot the scenario cost by more than this to get a cut.
    private static double absoluteTolerance;
    private static double relativeTolerance;
    private static int maxIterations;
    private static int timeLimitInSeconds; // 0 means no limit.

    // Multi-threading parameters
    private static boolean runScenariosInParallel;
    private static int numThreads;

    // Scenario sampling parameters
    private static int numGeneratedScenarios; // 0 keeps the scenarios of the instance file.
    private static Enums.DistributionType distributionType;
    private static double coefficientOfVariation;
    private static long seed;

    static {
        restoreDefaults();
    }

    /**
     * Resets every parameter to its default value.
     */
    public static void restoreDefaults() {
        instancePath = "data/instance.yaml";
        outputPath = "solution";
        outputName = "result.yaml";
        model = Enums.Model.BENDERS;

        lpSolverId = "GLOP";
        mipSolverId = "SCIP";

        cutTolerance = 1e-6;
        absoluteTolerance = 1e-6;
        relativeTolerance = 1e-6;
        maxIterations = 100;
        timeLimitInSeconds = 0;

        runScenariosInParallel = false;
        numThreads = 1;

        numGeneratedScenarios = 0;
        distributionType = Enums.DistributionType.TRUNCATED_NORMAL;
        coefficientOfVariation = 0.25;
        seed = 0L;
    }

    public static String getInstancePath() {
        return instancePath;
    }

    public static void setInstancePath(String instancePath) {
        Parameters.instancePath = instancePath;
    }

    public static String getOutputPath() {
        return outputPath;
    }

    public static void setOutputPath(String outputPath) {
        Parameters.outputPath = outputPath;
    }

    public static String getOutputName() {
        return outputName;
    }

    public static void setOutputName(String outputName) {
        Parameters.outputName = outputName;
    }

    public static Enums.Model getModel() {
        return model;
    }

    public static void setModel(Enums.Model model) {
        Parameters.model = model;
    }

    public static String getLpSolverId() {
        return lpSolverId;
    }

    public static void setLpSolverId(String lpSolverId) {
        Parameters.lpSolverId = lpSolverId;
    }

    public static String getMipSolverId() {
        return mipSolverId;
    }

    public static void setMipSolverId(String mipSolverId) {
        Parameters.mipSolverId = mipSolverId;
    }

    public static double getCutTolerance() {
        return cutTolerance;
    }

    public static void setCutTolerance(double cutTolerance) {
        Parameters.cutTolerance = cutTolerance;
    }

    public static double getAbsoluteTolerance() {
        return absoluteTolerance;
    }

    public static void setAbsoluteTolerance(double absoluteTolerance) {
        Parameters.absoluteTolerance = absoluteTolerance;
    }

    public static double getRelativeTolerance() {
        return relativeTolerance;
    }

    public static void setRelativeTolerance(double relativeTolerance) {
        Parameters.relativeTolerance = relativeTolerance;
    }

    public static int getMaxIterations() {
        return maxIterations;
    }

    public static void setMaxIterations(int maxIterations) {
        Parameters.maxIterations = maxIterations;
    }

    public static int getTimeLimitInSeconds() {
        return timeLimitInSeconds;
    }

    public static void setTimeLimitInSeconds(int timeLimitInSeconds) {
        Parameters.timeLimitInSeconds = timeLimitInSeconds;
    }

    public static boolean isRunScenariosInParallel() {
        return runScenariosInParallel;
    }

    public static void setRunScenariosInParallel(boolean runScenariosInParallel) {
        Parameters.runScenariosInParallel = runScenariosInParallel;
    }

    public static int getNumThreads() {
        return numThreads;
    }

    public static void setNumThreads(int numThreads) {
        Parameters.numThreads = numThreads;
    }

    public static int getNumGeneratedScenarios() {
        return numGeneratedScenarios;
    }

    public static void setNumGeneratedScenarios(int numGeneratedScenarios) {
        Parameters.numGeneratedScenarios = numGeneratedScenarios;
    }

    public static Enums.DistributionType getDistributionType() {
        return distributionType;
    }

    public static void setDistributionType(Enums.DistributionType distributionType) {
        Parameters.distributionType = distributionType;
    }

    public static double getCoefficientOfVariation() {
        return coefficientOfVariation;
    }

    public static void setCoefficientOfVariation(double coefficientOfVariation) {
        Parameters.coefficientOfVariation = coefficientOfVariation;
    }

    public static long getSeed() {
        return seed;
    }

    public static void setSeed(long seed) {
        Parameters.seed = seed;
    }

    public static HashMap<String, Object> asMap() {
        HashMap<String, Object> results = new HashMap<>();
        results.put("instancePath", instancePath);
        results.put("model", model.name());
        results.put("lpSolver", lpSolverId);
        results.put("mipSolver", mipSolverId);
        results.put("cutTolerance", cutTolerance);
        results.put("absoluteTolerance", absoluteTolerance);
        results.put("relativeTolerance", relativeTolerance);
        results.put("maxIterations", maxIterations);
        results.put("timeLimitInSeconds", timeLimitInSeconds);
        results.put("numThreads", runScenariosInParallel ? numThreads : 1);
        if (numGeneratedScenarios > 0) {
            results.put("numGeneratedScenarios", numGeneratedScenarios);
            results.put("distributionType", distributionType.name());
            results.put("coefficientOfVariation", coefficientOfVariation);
            results.put("seed", seed);
        }
        return results;
    }
}
