package floc.demand;

import floc.utility.Enums;
import org.apache.commons.math3.distribution.ExponentialDistribution;
import org.apache.commons.math3.distribution.LogNormalDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.RealDistribution;
import org.apache.commons.math3.random.RandomGenerator;

class DemandSampler {
    /**
     * generates non-negative demand samples based on specified distribution, mean and coefficient of variation.
     */
    private final double mean;
    private final RealDistribution distribution; // null when demand is deterministic.

    DemandSampler(RandomGenerator rng, Enums.DistributionType distributionType, double mean,
                  double coefficientOfVariation) {
        this.mean = mean;
        if (mean <= 0.0) {
            distribution = null;
            return;
        }

        final double sd = coefficientOfVariation * mean;
        switch (distributionType) {
            case TRUNCATED_NORMAL:
                distribution = sd > 0.0 ? new NormalDistribution(rng, mean, sd) : null;
                break;
            case LOG_NORMAL:
                distribution = sd > 0.0 ? getLogNormal(rng, mean, sd) : null;
                break;
            default:
                distribution = new ExponentialDistribution(rng, mean);
        }
    }

    /**
     * The values of lognormal and exponential will always be non-negative. However, the negativity check is needed
     * for the normal distribution truncated at 0.
     *
     * @return random demand rounded to two decimals.
     */
    double sample() {
        if (distribution == null)
            return round(mean);
        while (true) {
            final double realization = distribution.sample();
            if (realization >= 0.0)
                return round(realization);
        }
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    /**
     * returns a lognormal distribution with the given mean and standard deviation of X. The apache class is
     * parameterized by the mean (scale) and sd (shape) of ln(X).
     */
    private static LogNormalDistribution getLogNormal(RandomGenerator rng, double mean, double sd) {
        final double c = 1 + ((sd * sd) / (mean * mean));
        final double normalMean = Math.log(mean / Math.sqrt(c)); // scale of lognormal
        final double normalSd = Math.sqrt(Math.log(c)); // shape of lognormal
        return new LogNormalDistribution(rng, normalMean, normalSd);
    }
}
