package de.tu_berlin.dos.arm.arx;

import de.tu_berlin.dos.arm.arx.modeling.Forecast;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RunTest {

    @Test
    void forecastsReferenceDataset() throws Exception {

        Properties props = new Properties();
        props.setProperty("model.autoregressiveLags", "3");
        props.setProperty("model.externalInputLags", "3");
        props.setProperty("model.stepSize", "25.0");
        props.setProperty("forecast.horizon", "25");

        Forecast forecast = Run.run(new ForecastConfig(props));

        assertEquals(85 + 25, forecast.size());
        assertEquals(2070 + 25 * 25.0, forecast.getLast().input, 1e-6);
        assertEquals(1578.0077, forecast.getPoints().get(0).value, 1e-6);
    }

    @Test
    void singularForecastCanBeRejected() {

        Properties props = new Properties();
        props.setProperty("data.file", "zero-inputs.csv");
        props.setProperty("forecast.failOnSingular", "true");

        assertThrows(IllegalStateException.class, () -> Run.run(new ForecastConfig(props)));
    }
}
