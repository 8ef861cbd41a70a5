package de.tu_berlin.dos.arm.arx.modeling;

import de.tu_berlin.dos.arm.arx.io.Observation;
import de.tu_berlin.dos.arm.arx.io.TimeSeries;
import de.tu_berlin.dos.arm.arx.modeling.CoefficientEstimator.Condition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PredictorTest {

    private static final double[] INPUTS = {3, 1, 4, 1, 5, 9, 2, 6, 5, 3, 5, 8, 9, 7, 9, 3, 2, 3, 8, 4};

    private double[] values;
    private Predictor predictor;

    @BeforeEach
    void setUp() {

        values = ArxFixtures.simulate(INPUTS, 1.0);
        predictor = new Predictor(ArxFixtures.rows(values, INPUTS), new ModelParameters(1, 1, 1.0));
    }

    @Test
    void constructionValidatesParameters() {

        double[][] data = {{1, 1}, {2, 2}};
        assertThrows(InvalidParameterException.class, () -> new Predictor(data, new ModelParameters(0, 0, 1.0)));
        assertThrows(InvalidParameterException.class, () -> new Predictor(data, new ModelParameters(1, -1, 1.0)));
        assertThrows(InvalidParameterException.class, () -> new Predictor(data, new ModelParameters(1, 0, 0.0)));
    }

    @Test
    void forecastHasHistoryPlusHorizonPoints() {

        Forecast forecast = predictor.forecast(5);

        assertEquals(INPUTS.length + 5, forecast.size());
        assertEquals(5, forecast.getPredictions().size());
        assertEquals(4 + 5 * 1.0, forecast.getLast().input, 1e-6);
        for (int i = 0; i < INPUTS.length; i++) {

            assertEquals(INPUTS[i], forecast.getPoints().get(i).input, 0.0);
        }
    }

    @Test
    void recoversCoefficientsOfExactSeries() {

        Forecast forecast = predictor.forecast(3);

        assertEquals(Condition.REGULAR, forecast.getCondition());
        assertFalse(forecast.isSingular());
        assertArrayEquals(ArxFixtures.THETA.toArray(), forecast.getCoefficients(), 1e-6);
    }

    @Test
    void predictionsFollowTheModel() {

        List<Observation> points = predictor.forecast(4).getPoints();

        int n = INPUTS.length;
        for (int i = n; i < points.size(); i++) {

            double expected = ArxFixtures.next(points.get(i - 1).value, points.get(i).input, points.get(i - 1).input);
            assertEquals(expected, points.get(i).value, 1e-6);
        }
        // first m + 1 positions are never recomputed
        assertEquals(values[0], points.get(0).value, 0.0);
        assertEquals(values[1], points.get(1).value, 0.0);
    }

    @Test
    void insufficientDataIsReported() {

        Predictor shortPredictor = new Predictor(new double[][]{{1, 0}, {2, 1}, {3, 2}}, new ModelParameters(3, 1, 1.0));

        InsufficientDataException e = assertThrows(InsufficientDataException.class, () -> shortPredictor.forecast(2));
        assertEquals(3, e.getAvailable());
        assertEquals(4, e.getRequired());
        assertEquals(Predictor.State.CONSTRUCTED, shortPredictor.getState());

        Predictor empty = new Predictor(new double[0][], new ModelParameters(1, 0, 1.0));
        assertThrows(InsufficientDataException.class, () -> empty.forecast(1));
    }

    @Test
    void rejectsNegativeHorizon() {

        assertThrows(InvalidParameterException.class, () -> predictor.forecast(-1));
    }

    @Test
    void stateChangesAfterForecast() {

        assertEquals(Predictor.State.CONSTRUCTED, predictor.getState());
        predictor.forecast(1);
        assertEquals(Predictor.State.FORECASTED, predictor.getState());
    }

    @Test
    void repeatedForecastsAreIdentical() {

        Forecast first = predictor.forecast(10);
        Forecast second = predictor.forecast(10);

        assertEquals(first.getPoints(), second.getPoints());
        assertArrayEquals(first.getCoefficients(), second.getCoefficients(), 0.0);
    }

    @Test
    void horizonsCanChangeBetweenCalls() {

        Forecast none = predictor.forecast(0);
        Forecast some = predictor.forecast(3);

        assertEquals(INPUTS.length, none.size());
        assertTrue(none.getPredictions().isEmpty());
        assertEquals(INPUTS.length + 3, some.size());
        assertEquals(none.getPoints(), some.getPoints().subList(0, INPUTS.length));
    }

    @Test
    void singularSystemStillForecasts() {

        TimeSeries series = TimeSeries.of(new double[][]{{1, 0}, {2, 0}, {3, 0}, {4, 0}});
        Forecast forecast = new Predictor(series, new ModelParameters(1, 0, 1.0)).forecast(2);

        assertTrue(forecast.isSingular());
        assertEquals(6, forecast.size());
        assertEquals(2.0, forecast.getLast().input, 1e-6);
        for (Observation point : forecast.getPoints()) {

            assertTrue(Double.isFinite(point.value));
        }
    }

    @Test
    void evenlySpacedInputsAreFlaggedSingular() {

        double[][] rows = new double[40][];
        for (int i = 0; i < rows.length; i++) {

            rows[i] = new double[]{1500 + 37 * Math.sin(i), 1000 + 25 * i};
        }
        Forecast forecast = new Predictor(rows, new ModelParameters(1, 2, 25.0)).forecast(5);

        assertTrue(forecast.isSingular());
        assertEquals(45, forecast.size());
        assertEquals(1000 + 25 * 39 + 5 * 25.0, forecast.getLast().input, 1e-6);
    }
}
