package teranet.mapdev.loadseries.imputation;

import org.apache.commons.math3.analysis.interpolation.UnivariateInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NonMonotonicSequenceException;
import org.apache.commons.math3.exception.NotFiniteNumberException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.apache.commons.math3.exception.util.LocalizedFormats;
import org.apache.commons.math3.util.MathArrays;
import org.apache.commons.math3.util.MathUtils;

/**
 * Piecewise cubic Hermite interpolating polynomial (PCHIP).
 *
 * Slopes at the knots follow Fritsch and Butland: zero at local extrema, a weighted
 * harmonic mean of the neighbouring secants elsewhere, and a one-sided three-point
 * estimate at both ends. The resulting curve is monotone wherever the data is, so it does
 * not overshoot between readings the way a natural cubic spline can.
 *
 * Like the other commons-math interpolators the returned function is only defined on
 * [x[0], x[n-1]]; evaluating outside that range throws.
 */
public class PchipInterpolator implements UnivariateInterpolator {

    private static final int MINIMUM_POINTS = 3;

    /**
     * @param x strictly increasing abscissas, at least 3
     * @param y finite ordinates, same length as x
     * @throws DimensionMismatchException     if x and y differ in length
     * @throws NumberIsTooSmallException      if fewer than 3 points are given
     * @throws NonMonotonicSequenceException  if x is not strictly increasing
     * @throws NotFiniteNumberException       if any value is NaN or infinite
     */
    @Override
    public PolynomialSplineFunction interpolate(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new DimensionMismatchException(x.length, y.length);
        }
        if (x.length < MINIMUM_POINTS) {
            throw new NumberIsTooSmallException(LocalizedFormats.NUMBER_OF_POINTS,
                    x.length, MINIMUM_POINTS, true);
        }
        MathUtils.checkFinite(x);
        MathUtils.checkFinite(y);
        MathArrays.checkOrder(x);

        int n = x.length;
        double[] h = new double[n - 1];
        double[] secant = new double[n - 1];
        for (int k = 0; k < n - 1; k++) {
            h[k] = x[k + 1] - x[k];
            secant[k] = (y[k + 1] - y[k]) / h[k];
        }

        double[] slope = new double[n];
        for (int k = 1; k < n - 1; k++) {
            double left = secant[k - 1];
            double right = secant[k];
            if (left == 0.0 || right == 0.0 || Math.signum(left) != Math.signum(right)) {
                slope[k] = 0.0;
            } else {
                double w1 = 2.0 * h[k] + h[k - 1];
                double w2 = h[k] + 2.0 * h[k - 1];
                slope[k] = (w1 + w2) / (w1 / left + w2 / right);
            }
        }
        slope[0] = endSlope(h[0], h[1], secant[0], secant[1]);
        slope[n - 1] = endSlope(h[n - 2], h[n - 3], secant[n - 2], secant[n - 3]);

        PolynomialFunction[] segments = new PolynomialFunction[n - 1];
        for (int k = 0; k < n - 1; k++) {
            double c2 = (3.0 * secant[k] - 2.0 * slope[k] - slope[k + 1]) / h[k];
            double c3 = (slope[k] + slope[k + 1] - 2.0 * secant[k]) / (h[k] * h[k]);
            segments[k] = new PolynomialFunction(new double[] {y[k], slope[k], c2, c3});
        }
        return new PolynomialSplineFunction(x.clone(), segments);
    }

    /**
     * Non-centered three-point slope at an end knot, limited so the end segment stays
     * shape preserving.
     */
    private static double endSlope(double h0, double h1, double m0, double m1) {
        double d = ((2.0 * h0 + h1) * m0 - h0 * m1) / (h0 + h1);
        if (Math.signum(d) != Math.signum(m0)) {
            return 0.0;
        }
        if (Math.signum(m0) != Math.signum(m1) && Math.abs(d) > 3.0 * Math.abs(m0)) {
            return 3.0 * m0;
        }
        return d;
    }
}
