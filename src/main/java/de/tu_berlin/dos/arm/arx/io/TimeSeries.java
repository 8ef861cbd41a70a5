package de.tu_berlin.dos.arm.arx.io;

import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered sequence of observations. Positions are significant: lags are counted in samples, so the
 * series is never re-sorted by its input values.
 */
public class TimeSeries {

    /******************************************************************************
     * CLASS BEHAVIOURS
     ******************************************************************************/

    /**
     * Creates a time series from rows of the form {@code [value, input]}.
     */
    public static TimeSeries of(double[][] rows) {

        Validate.notNull(rows, "rows must not be null");
        List<Observation> observations = new ArrayList<>(rows.length);
        for (int i = 0; i < rows.length; i++) {

            Validate.isTrue(rows[i] != null && rows[i].length >= 2, "row %d must hold a value and an input", i);
            observations.add(new Observation(rows[i][0], rows[i][1]));
        }
        return new TimeSeries(observations);
    }

    public static TimeSeries of(List<Observation> observations) {

        Validate.noNullElements(observations, "observations must not contain null elements");
        return new TimeSeries(new ArrayList<>(observations));
    }

    /******************************************************************************
     * INSTANCE STATE
     ******************************************************************************/

    public final List<Observation> observations;

    /******************************************************************************
     * CONSTRUCTOR(S)
     ******************************************************************************/

    private TimeSeries(List<Observation> observations) {

        this.observations = Collections.unmodifiableList(observations);
    }

    /******************************************************************************
     * INSTANCE BEHAVIOUR
     ******************************************************************************/

    public int size() {

        return this.observations.size();
    }

    public boolean isEmpty() {

        return this.observations.isEmpty();
    }

    public double[] values() {

        return this.observations.stream().mapToDouble(o -> o.value).toArray();
    }

    public double[] inputs() {

        return this.observations.stream().mapToDouble(o -> o.input).toArray();
    }

    public Observation getLast() {

        if (this.observations.isEmpty()) throw new IllegalStateException("Time series is empty");
        return this.observations.get(this.observations.size() - 1);
    }

    @Override
    public String toString() {

        return "TimeSeries{" +
                "observations=" + observations +
                ", count=" + observations.size() +
                '}';
    }
}
