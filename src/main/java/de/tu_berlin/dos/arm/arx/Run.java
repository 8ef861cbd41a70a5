package de.tu_berlin.dos.arm.arx;

import de.tu_berlin.dos.arm.arx.io.FileParser;
import de.tu_berlin.dos.arm.arx.io.Observation;
import de.tu_berlin.dos.arm.arx.io.TimeSeries;
import de.tu_berlin.dos.arm.arx.modeling.Forecast;
import de.tu_berlin.dos.arm.arx.modeling.Predictor;
import de.tu_berlin.dos.arm.arx.utils.FileReader;
import org.apache.log4j.Logger;

import java.io.File;
import java.io.InputStream;
import java.util.Arrays;

public class Run {

    private static final Logger LOG = Logger.getLogger(Run.class);

    public static void main(String[] args) throws Exception {

        // optional first argument overrides the properties file name
        ForecastConfig config = ForecastConfig.load(args.length > 0 ? args[0] : ForecastConfig.DEFAULT_FILE);
        Forecast forecast = run(config);
        for (Observation point : forecast.getPredictions()) {

            LOG.info(point.input + " " + point.value);
        }
    }

    public static Forecast run(ForecastConfig config) throws Exception {

        // read the historical series
        // a file on disk wins over a classpath resource of the same name
        File dataFile = new File(config.dataFile);
        TimeSeries series;
        if (dataFile.exists()) {

            series = FileParser.GET.fromCSV(dataFile, config.separator, config.header);
        }
        else {

            InputStream input = FileReader.GET.read(config.dataFile, InputStream.class);
            series = FileParser.GET.fromCSV(input, config.dataFile, config.separator, config.header);
        }
        LOG.info("Loaded " + series.size() + " observations from " + config.dataFile);

        // fit and forecast
        Predictor predictor = new Predictor(series, config.modelParameters(), config.estimator());
        Forecast forecast = predictor.forecast(config.horizon);
        LOG.info("Coefficients: " + Arrays.toString(forecast.getCoefficients()));

        if (forecast.isSingular()) {

            if (config.failOnSingular) throw new IllegalStateException("Coefficient matrix is singular, forecast rejected");
            LOG.warn("Coefficient matrix is singular, forecast may be degenerate");
        }
        return forecast;
    }
}
