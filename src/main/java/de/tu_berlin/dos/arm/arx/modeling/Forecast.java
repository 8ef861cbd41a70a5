package de.tu_berlin.dos.arm.arx.modeling;

import de.tu_berlin.dos.arm.arx.io.Observation;
import de.tu_berlin.dos.arm.arx.modeling.CoefficientEstimator.Condition;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class Forecast {

    private final List<Observation> points;
    private final int historySize;
    private final Condition condition;
    private final double[] coefficients;

    public Forecast(List<Observation> points, int historySize, Condition condition, double[] coefficients) {

        this.points = Collections.unmodifiableList(points);
        this.historySize = historySize;
        this.condition = condition;
        this.coefficients = coefficients.clone();
    }

    public List<Observation> getPoints() {

        return points;
    }

    /**
     * Only the entries beyond the historical series.
     */
    public List<Observation> getPredictions() {

        return points.subList(historySize, points.size());
    }

    public int size() {

        return points.size();
    }

    public Observation getLast() {

        return points.get(points.size() - 1);
    }

    public Condition getCondition() {

        return condition;
    }

    public boolean isSingular() {

        return condition == Condition.SINGULAR;
    }

    public double[] getCoefficients() {

        return coefficients.clone();
    }

    @Override
    public String toString() {
        return "Forecast{" +
                "points=" + points +
                ", condition=" + condition +
                ", coefficients=" + Arrays.toString(coefficients) +
                '}';
    }
}
