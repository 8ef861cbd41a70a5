package de.tu_berlin.dos.arm.arx.modeling;

import org.apache.commons.lang3.Validate;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.log4j.Logger;

import java.util.Optional;

/**
 * Builds the lagged regression matrix (phi). Row {@code i} describes series index {@code t = i + m}
 * with {@code m = max(na, nb)}:
 * <pre>
 *   [ -y[t-1] ... -y[t-na] | p[t] p[t-1] ... p[t-nb] ]
 * </pre>
 * Lagged terms that would reach before the start of the series are zero.
 */
public class DesignMatrixBuilder {

    private static final Logger LOG = Logger.getLogger(DesignMatrixBuilder.class);

    private DesignMatrixBuilder() {}

    /**
     * @return the design matrix, or empty when the series holds no more than {@code max(na, nb)}
     *         samples
     */
    public static Optional<RealMatrix> build(double[] values, double[] inputs, int na, int nb) {

        Validate.isTrue(na >= 0 && nb >= 0, "Lags must not be negative, na: %d, nb: %d", na, nb);
        if (values.length != inputs.length) throw new DimensionMismatchException(inputs.length, values.length);

        int m = Math.max(na, nb);
        int numRows = values.length - m;
        if (numRows <= 0) {

            LOG.debug("No design rows for " + values.length + " samples with lag window " + m);
            return Optional.empty();
        }

        int dim = na + nb + 1;
        RealMatrix phi = new Array2DRowRealMatrix(numRows, dim);
        for (int i = 0; i < numRows; i++) {

            int t = i + m;
            // negated past values
            for (int j = 1; j <= na; j++) {

                if (t - j >= 0) phi.setEntry(i, j - 1, -values[t - j]);
            }
            // current and past inputs
            for (int j = 0; j <= nb; j++) {

                if (t - j >= 0) phi.setEntry(i, na + j, inputs[t - j]);
            }
        }
        return Optional.of(phi);
    }
}
