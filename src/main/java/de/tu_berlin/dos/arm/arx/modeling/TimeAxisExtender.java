package de.tu_berlin.dos.arm.arx.modeling;

import org.apache.commons.lang3.Validate;

import java.util.Arrays;

public class TimeAxisExtender {

    private TimeAxisExtender() {}

    /**
     * Appends {@code numToPredict} inputs to the historical ones, each {@code stepSize} after the
     * previous one. The returned array is always a fresh copy.
     */
    public static double[] extend(double[] inputs, int numToPredict, double stepSize) {

        Validate.isTrue(inputs != null && inputs.length > 0, "At least one historical input is required");
        Validate.isTrue(numToPredict >= 0, "Number of values to predict must not be negative: %d", numToPredict);

        double[] extended = Arrays.copyOf(inputs, inputs.length + numToPredict);
        double last = inputs[inputs.length - 1];
        for (int k = 1; k <= numToPredict; k++) {

            extended[inputs.length + k - 1] = last + k * stepSize;
        }
        return extended;
    }
}
