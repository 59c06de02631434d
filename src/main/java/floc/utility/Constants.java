package floc.utility;

public class Constants {
    public final static double EPS = 1e-6;
    public final static double PROBABILITY_TOLERANCE = 1e-6;
    public final static double OPEN_THRESHOLD = 0.5;
    public final static double DUALITY_TOLERANCE = 1e-5;
    public final static double MIP_GAP = 1e-7;
    public final static int ERROR_CODE = 17;
    public final static long NO_TIME_LIMIT = 0L;
    public final static String STANDARD_STREAM = "-"; // stands for stdin/stdout in logs and results.
}
