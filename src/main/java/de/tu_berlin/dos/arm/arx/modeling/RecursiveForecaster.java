package de.tu_berlin.dos.arm.arx.modeling;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.linear.RealVector;

/**
 * Runs the fitted model forward over the extended input axis. Positions {@code 0..m} keep the
 * historical values; every later position is computed from earlier positions of the same buffer,
 * so predictions are fed back as autoregressive inputs.
 */
public class RecursiveForecaster {

    private RecursiveForecaster() {}

    public static double[] forecast(double[] values, double[] extendedInputs, RealVector theta, int m, int na, int nb) {

        if (theta.getDimension() != na + nb + 1) throw new DimensionMismatchException(theta.getDimension(), na + nb + 1);

        double[] yAp = seed(values, extendedInputs.length);
        for (int i = m + 1; i < yAp.length; i++) {

            double sum = 0.0;
            // autoregressive part
            for (int j = 1; j <= na; j++) {

                if (i - j >= 0) sum -= theta.getEntry(j - 1) * yAp[i - j];
            }
            // external input part
            for (int j = 0; j <= nb; j++) {

                if (i - j >= 0) sum += theta.getEntry(na + j) * extendedInputs[i - j];
            }
            yAp[i] = sum;
        }
        return yAp;
    }

    /**
     * Buffer of the given length whose leading entries are the historical values.
     */
    static double[] seed(double[] values, int length) {

        double[] buffer = new double[length];
        System.arraycopy(values, 0, buffer, 0, Math.min(length, values.length));
        return buffer;
    }
}
