package de.tu_berlin.dos.arm.arx.modeling;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.log4j.Logger;

import java.util.Arrays;

/**
 * Least-squares estimate of the model coefficients from the normal equations
 * {@code (phi' * phi) * theta = phi' * y}. A rank deficient design does not abort the estimate:
 * the pseudo-inverse is used instead and the result is flagged as singular.
 */
public class CoefficientEstimator {

    /******************************************************************************
     * STATIC INNER CLASSES
     ******************************************************************************/

    public enum Condition {

        REGULAR,
        SINGULAR;
    }

    public static class Estimate {

        public final RealVector theta;
        public final Condition condition;

        public Estimate(RealVector theta, Condition condition) {

            this.theta = theta;
            this.condition = condition;
        }

        public boolean isSingular() {

            return this.condition == Condition.SINGULAR;
        }

        @Override
        public String toString() {
            return "Estimate{" +
                    "theta=" + Arrays.toString(theta.toArray()) +
                    ", condition=" + condition +
                    '}';
        }
    }

    /******************************************************************************
     * CLASS VARIABLES
     ******************************************************************************/

    private static final Logger LOG = Logger.getLogger(CoefficientEstimator.class);

    // relative to the largest singular value of the design matrix
    public static final double DEFAULT_SINGULARITY_THRESHOLD = 1e-10;

    /******************************************************************************
     * INSTANCE STATE
     ******************************************************************************/

    private final double singularityThreshold;

    /******************************************************************************
     * CONSTRUCTOR(S)
     ******************************************************************************/

    public CoefficientEstimator() {

        this(DEFAULT_SINGULARITY_THRESHOLD);
    }

    public CoefficientEstimator(double singularityThreshold) {

        if (!(singularityThreshold >= 0)) {

            throw new InvalidParameterException("Singularity threshold must not be negative: " + singularityThreshold);
        }
        this.singularityThreshold = singularityThreshold;
    }

    /******************************************************************************
     * INSTANCE BEHAVIOUR
     ******************************************************************************/

    /**
     * @param phi    design matrix with one row per estimable time step
     * @param values the full value series, its last {@code phi.getRowDimension()} entries are the
     *               regression targets
     */
    public Estimate estimate(RealMatrix phi, double[] values) {

        int rows = phi.getRowDimension();
        if (values.length < rows) throw new DimensionMismatchException(values.length, rows);

        RealVector y = new ArrayRealVector(Arrays.copyOfRange(values, values.length - rows, values.length), false);
        requireFinite(phi, y);

        // rank is judged on phi itself, relative to its largest singular value
        SingularValueDecomposition svd = new SingularValueDecomposition(phi);
        double[] singularValues = svd.getSingularValues();
        double tolerance = this.singularityThreshold * singularValues[0];
        if (rank(singularValues, tolerance) == phi.getColumnDimension()) {

            RealMatrix phiT = phi.transpose();
            DecompositionSolver solver = new LUDecomposition(phiT.multiply(phi), 0.0).getSolver();
            return new Estimate(solver.solve(phiT.operate(y)), Condition.REGULAR);
        }

        LOG.warn("Coefficient matrix is singular (rank " + rank(singularValues, tolerance) + " of "
            + phi.getColumnDimension() + "), falling back to the pseudo-inverse");
        return new Estimate(pseudoInverseSolve(svd, singularValues, tolerance, y), Condition.SINGULAR);
    }

    public double getSingularityThreshold() {

        return singularityThreshold;
    }

    private static int rank(double[] singularValues, double tolerance) {

        int rank = 0;
        for (double s : singularValues) {

            if (s > tolerance) rank++;
        }
        return rank;
    }

    /**
     * Minimum norm least-squares solution {@code V * S^+ * U' * y}, singular values at or below the
     * tolerance are treated as zero.
     */
    private static RealVector pseudoInverseSolve(SingularValueDecomposition svd, double[] singularValues, double tolerance, RealVector y) {

        RealVector projected = svd.getUT().operate(y);
        for (int i = 0; i < singularValues.length; i++) {

            projected.setEntry(i, singularValues[i] > tolerance ? projected.getEntry(i) / singularValues[i] : 0.0);
        }
        return svd.getV().operate(projected);
    }

    private static void requireFinite(RealMatrix phi, RealVector y) {

        for (int i = 0; i < phi.getRowDimension(); i++) {

            for (int j = 0; j < phi.getColumnDimension(); j++) {

                if (!Double.isFinite(phi.getEntry(i, j))) {

                    throw new IllegalArgumentException("Design matrix holds a non-finite entry at (" + i + ", " + j + ")");
                }
            }
            if (!Double.isFinite(y.getEntry(i))) {

                throw new IllegalArgumentException("Regression target " + i + " is not finite");
            }
        }
    }
}
