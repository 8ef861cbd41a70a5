package de.tu_berlin.dos.arm.arx.modeling;

import de.tu_berlin.dos.arm.arx.io.Observation;
import de.tu_berlin.dos.arm.arx.io.TimeSeries;
import de.tu_berlin.dos.arm.arx.modeling.CoefficientEstimator.Estimate;
import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.time.StopWatch;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Fits an autoregressive model with an external input to a time series and forecasts it. Every call
 * to {@link #forecast(int)} runs the whole pipeline again, nothing is cached between calls.
 * Instances are not meant to be shared between threads.
 */
public class Predictor {

    public enum State {

        CONSTRUCTED,
        FORECASTED;
    }

    private static final Logger LOG = Logger.getLogger(Predictor.class);

    private final TimeSeries series;
    private final ModelParameters params;
    private final CoefficientEstimator estimator;
    private State state = State.CONSTRUCTED;

    public Predictor(double[][] data, ModelParameters params) {

        this(TimeSeries.of(data), params);
    }

    public Predictor(TimeSeries series, ModelParameters params) {

        this(series, params, new CoefficientEstimator());
    }

    public Predictor(TimeSeries series, ModelParameters params, CoefficientEstimator estimator) {

        ParameterValidator.validate(params);
        this.series = Validate.notNull(series, "series must not be null");
        this.params = params;
        this.estimator = Validate.notNull(estimator, "estimator must not be null");
    }

    /**
     * @param numToPredict number of steps beyond the end of the series
     * @return {@code series.size() + numToPredict} points, see {@link Forecast}
     * @throws InsufficientDataException if the series is not longer than the lag window
     */
    public Forecast forecast(int numToPredict) {

        if (numToPredict < 0) throw new InvalidParameterException("Number of values to predict must not be negative: " + numToPredict);

        int na = this.params.autoregressiveLags;
        int nb = this.params.externalInputLags;
        int m = this.params.lagWindow();

        if (this.series.size() <= m) throw new InsufficientDataException(this.series.size(), m + 1);

        StopWatch stopWatch = StopWatch.createStarted();
        double[] values = this.series.values();
        double[] inputs = this.series.inputs();

        double[] pl = TimeAxisExtender.extend(inputs, numToPredict, this.params.stepSize);
        RealMatrix phi = DesignMatrixBuilder.build(values, inputs, na, nb)
            .orElseThrow(() -> new InsufficientDataException(values.length, m + 1));
        Estimate estimate = this.estimator.estimate(phi, values);
        double[] yAp = RecursiveForecaster.forecast(values, pl, estimate.theta, m, na, nb);

        List<Observation> points = new ArrayList<>(pl.length);
        for (int i = 0; i < pl.length; i++) {

            points.add(new Observation(yAp[i], pl[i]));
        }
        this.state = State.FORECASTED;
        stopWatch.stop();

        LOG.info("Forecasted " + numToPredict + " steps from " + values.length + " samples with " + this.params
            + " in " + stopWatch.getTime() + "ms (" + estimate.condition + ")");
        return new Forecast(points, values.length, estimate.condition, estimate.theta.toArray());
    }

    public State getState() {

        return state;
    }
}
