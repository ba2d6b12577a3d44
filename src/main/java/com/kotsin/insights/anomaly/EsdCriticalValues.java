package com.kotsin.insights.anomaly;

/**
 * Critical values for the generalized ESD (Rosner) outlier test.
 *
 * For a sample of m points at significance alpha:
 * <pre>
 *   p      = 1 - alpha / (2m)
 *   t      = Student-t quantile at p with m - 2 degrees of freedom
 *   lambda = (m - 1) t / sqrt((m - 2 + t^2) m)
 * </pre>
 * The t quantile is exact for 1 and 2 degrees of freedom and uses the Cornish-Fisher
 * expansion around the normal quantile otherwise.
 */
public final class EsdCriticalValues {

    private EsdCriticalValues() {}

    // Acklam's rational approximation of the inverse normal CDF
    private static final double[] A = {
            -3.969683028665376e+01, 2.209460984245205e+02, -2.759285104469687e+02,
            1.383577518672690e+02, -3.066479806614716e+01, 2.506628277459239e+00
    };
    private static final double[] B = {
            -5.447609879822406e+01, 1.615858368580409e+02, -1.556989798598866e+02,
            6.680131188771972e+01, -1.328068155288572e+01
    };
    private static final double[] C = {
            -7.784894002430293e-03, -3.223964580411365e-01, -2.400758277161838e+00,
            -2.549732539343734e+00, 4.374664141464968e+00, 2.938163982698783e+00
    };
    private static final double[] D = {
            7.784695709041462e-03, 3.224671290700398e-01, 2.445134137142996e+00,
            3.754408661907416e+00
    };
    private static final double P_LOW = 0.02425;
    private static final double P_HIGH = 1 - P_LOW;

    /**
     * ESD critical value for the current sample size.
     *
     * @param sampleSize points still in the working set
     * @param alpha      significance level in (0, 1)
     * @return lambda, or +Infinity when the sample is too small to test
     */
    public static double lambda(int sampleSize, double alpha) {
        if (sampleSize < 3) {
            return Double.POSITIVE_INFINITY;
        }
        double p = 1.0 - alpha / (2.0 * sampleSize);
        double t = studentTQuantile(p, sampleSize - 2);
        return (sampleSize - 1) * t / Math.sqrt((sampleSize - 2 + t * t) * sampleSize);
    }

    /**
     * Quantile of Student's t distribution.
     *
     * @param p  probability in (0, 1)
     * @param df degrees of freedom, at least 1
     */
    public static double studentTQuantile(double p, int df) {
        if (df < 1) {
            throw new IllegalArgumentException("Degrees of freedom must be positive: " + df);
        }
        if (df == 1) {
            return Math.tan(Math.PI * (p - 0.5));
        }
        if (df == 2) {
            return (2 * p - 1) / Math.sqrt(2 * p * (1 - p));
        }

        double z = normalQuantile(p);
        double z2 = z * z;
        double z3 = z2 * z;
        double z5 = z3 * z2;
        double z7 = z5 * z2;
        double z9 = z7 * z2;

        double g1 = (z3 + z) / 4.0;
        double g2 = (5 * z5 + 16 * z3 + 3 * z) / 96.0;
        double g3 = (3 * z7 + 19 * z5 + 17 * z3 - 15 * z) / 384.0;
        double g4 = (79 * z9 + 776 * z7 + 1482 * z5 - 1920 * z3 - 945 * z) / 92160.0;

        double v = df;
        return z + g1 / v + g2 / (v * v) + g3 / (v * v * v) + g4 / (v * v * v * v);
    }

    /**
     * Inverse of the standard normal CDF.
     *
     * @param p probability in (0, 1)
     */
    public static double normalQuantile(double p) {
        if (!(p > 0 && p < 1)) {
            throw new IllegalArgumentException("Probability must be between 0 and 1: " + p);
        }

        if (p < P_LOW) {
            double q = Math.sqrt(-2 * Math.log(p));
            return (((((C[0] * q + C[1]) * q + C[2]) * q + C[3]) * q + C[4]) * q + C[5])
                    / ((((D[0] * q + D[1]) * q + D[2]) * q + D[3]) * q + 1);
        }
        if (p <= P_HIGH) {
            double q = p - 0.5;
            double r = q * q;
            return (((((A[0] * r + A[1]) * r + A[2]) * r + A[3]) * r + A[4]) * r + A[5]) * q
                    / (((((B[0] * r + B[1]) * r + B[2]) * r + B[3]) * r + B[4]) * r + 1);
        }
        double q = Math.sqrt(-2 * Math.log(1 - p));
        return -(((((C[0] * q + C[1]) * q + C[2]) * q + C[3]) * q + C[4]) * q + C[5])
                / ((((D[0] * q + D[1]) * q + D[2]) * q + D[3]) * q + 1);
    }
}
