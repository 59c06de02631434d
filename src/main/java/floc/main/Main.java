package floc.main;

import floc.registry.Parameters;
import floc.utility.Constants;
import floc.utility.Enums;
import floc.utility.OptException;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Class that owns main().
 */
public class Main {
    private final static Logger logger = LogManager.getLogger(Main.class);

    public static void main(String[] args) {
        try {
            CommandLine cmd = addOptions(args);
            if (cmd == null)
                return;

            setDefaultParameters();
            updateParameters(cmd);
            singleRun();
        } catch (OptException ex) {
            logger.error(ex);
            System.exit(Constants.ERROR_CODE);
        }
    }

    static CommandLine addOptions(String[] args) throws OptException {
        Options options = new Options();
        options.addOption("absTolerance", true, "absolute Benders gap tolerance");
        options.addOption("cutTolerance", true, "minimum violation for an optimality cut to be added");
        options.addOption("cv", true, "coefficient of variation of sampled demands");
        options.addOption("distribution", true,
            "demand distribution for sampled scenarios (tnorm/lnorm/exp)");
        options.addOption("duration", true, "time limit in seconds (0 for none)");
        options.addOption("generateScenarios", true,
            "number of demand scenarios to sample instead of the instance scenarios");
        options.addOption("input", true, "path to instance file (yaml/json), empty to read standard input");
        options.addOption("lpSolver", true, "OR-Tools backend for linear programs (default GLOP)");
        options.addOption("maxIterations", true, "Benders iteration limit");
        options.addOption("mipSolver", true, "OR-Tools backend for mixed integer programs (default SCIP)");
        options.addOption("model", true, "model (benders/dep)");
        options.addOption("outputPath", true, "path to output folder");
        options.addOption("outputName", true, "name of output file, empty to write to standard output");
        options.addOption("parallel", true,
            "number of parallel runs for second stage");
        options.addOption("seed", true, "random seed for scenario sampling");
        options.addOption("tolerance", true, "relative Benders gap tolerance");
        options.addOption("h", false, "help (show options and exit)");

        CommandLineParser parser = new DefaultParser();
        try {
            CommandLine cmd = parser.parse(options, args);
            if (cmd.hasOption('h')) {
                HelpFormatter helpFormatter = new HelpFormatter();
                helpFormatter.printHelp("stochastic-facility-location.jar", options);
                return null;
            }
            return cmd;
        } catch (ParseException ex) {
            logger.error(ex);
            throw new OptException("error parsing CLI args");
        }
    }

    private static void singleRun() throws OptException {
        logger.info("Started optimization...");
        Controller controller = new Controller();
        controller.buildScenarios();
        controller.solve();
        controller.writeOutput();
        logger.info("completed optimization.");
    }

    private static void setDefaultParameters() {
        Parameters.restoreDefaults();
        Parameters.setTimeLimitInSeconds(30);

        // Multi-threading parameters
        final int numThreads = Runtime.getRuntime().availableProcessors();
        Parameters.setRunScenariosInParallel(numThreads > 1);
        Parameters.setNumThreads(numThreads);
    }

    static void updateParameters(CommandLine cmd) throws OptException {
        Parameters.setInstancePath(cmd.getOptionValue("input", Parameters.getInstancePath()));
        Parameters.setOutputPath(cmd.getOptionValue("outputPath", Parameters.getOutputPath()));
        Parameters.setOutputName(cmd.getOptionValue("outputName", Parameters.getOutputName()));
        if (cmd.hasOption("lpSolver"))
            Parameters.setLpSolverId(getSolverId(cmd, "lpSolver"));
        if (cmd.hasOption("mipSolver"))
            Parameters.setMipSolverId(getSolverId(cmd, "mipSolver"));
        if (cmd.hasOption("model")) {
            final String model = cmd.getOptionValue("model").toLowerCase();
            switch (model) {
                case "benders":
                    Parameters.setModel(Enums.Model.BENDERS);
                    break;
                case "dep":
                    Parameters.setModel(Enums.Model.DEP);
                    break;
                default:
                    throw new OptException("unknown model type, use benders/dep");
            }
        }
        else
            logger.info("model not provided, defaulting to Benders");
        if (cmd.hasOption("distribution")) {
            final String distribution = cmd.getOptionValue("distribution");
            switch (distribution) {
                case "exp":
                    Parameters.setDistributionType(Enums.DistributionType.EXPONENTIAL);
                    break;
                case "tnorm":
                    Parameters.setDistributionType(Enums.DistributionType.TRUNCATED_NORMAL);
                    break;
                case "lnorm":
                    Parameters.setDistributionType(Enums.DistributionType.LOG_NORMAL);
                    break;
                default:
                    throw new OptException("unknown distribution: " + distribution);
            }
        }
        try {
            if (cmd.hasOption("duration")) {
                final int duration = Integer.parseInt(cmd.getOptionValue("duration"));
                if (duration < 0)
                    throw new OptException("duration must be non-negative");
                Parameters.setTimeLimitInSeconds(duration);
            }
            if (cmd.hasOption("maxIterations")) {
                final int maxIterations = Integer.parseInt(cmd.getOptionValue("maxIterations"));
                if (maxIterations < 1)
                    throw new OptException("maxIterations must be at least 1");
                Parameters.setMaxIterations(maxIterations);
            }
            if (cmd.hasOption("tolerance"))
                Parameters.setRelativeTolerance(getTolerance(cmd, "tolerance"));
            if (cmd.hasOption("absTolerance"))
                Parameters.setAbsoluteTolerance(getTolerance(cmd, "absTolerance"));
            if (cmd.hasOption("cutTolerance"))
                Parameters.setCutTolerance(getTolerance(cmd, "cutTolerance"));
            if (cmd.hasOption("parallel")) {
                final int numThreads = Integer.parseInt(cmd.getOptionValue("parallel"));
                Parameters.setNumThreads(Math.max(numThreads, 1));
                Parameters.setRunScenariosInParallel(numThreads > 1);
            }
            if (cmd.hasOption("generateScenarios"))
                Parameters.setNumGeneratedScenarios(Integer.parseInt(cmd.getOptionValue("generateScenarios")));
            if (cmd.hasOption("cv"))
                Parameters.setCoefficientOfVariation(Double.parseDouble(cmd.getOptionValue("cv")));
            if (cmd.hasOption("seed"))
                Parameters.setSeed(Long.parseLong(cmd.getOptionValue("seed")));
        } catch (NumberFormatException ex) {
            logger.error(ex);
            throw new OptException("invalid numeric CLI argument: " + ex.getMessage());
        }
    }

    private static String getSolverId(CommandLine cmd, String option) throws OptException {
        final String solverId = cmd.getOptionValue(option).trim().toUpperCase();
        if (solverId.isEmpty())
            throw new OptException(option + " must name an OR-Tools backend");
        return solverId;
    }

    private static double getTolerance(CommandLine cmd, String option) throws OptException {
        final double tolerance = Double.parseDouble(cmd.getOptionValue(option));
        if (tolerance < 0.0)
            throw new OptException(option + " must be non-negative");
        return tolerance;
    }
}
