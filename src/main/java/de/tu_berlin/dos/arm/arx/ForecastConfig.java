package de.tu_berlin.dos.arm.arx;

import de.tu_berlin.dos.arm.arx.modeling.CoefficientEstimator;
import de.tu_berlin.dos.arm.arx.modeling.ModelParameters;
import de.tu_berlin.dos.arm.arx.utils.FileReader;

import java.io.IOException;
import java.util.Properties;

public class ForecastConfig {

    public static final String DEFAULT_FILE = "forecast.properties";

    /******************************************************************************
     * CLASS BEHAVIOURS
     ******************************************************************************/

    public static ForecastConfig load(String fileName) throws IOException {

        return new ForecastConfig(FileReader.GET.read(fileName, Properties.class));
    }

    /******************************************************************************
     * INSTANCE STATE
     ******************************************************************************/

    public final int autoregressiveLags;
    public final int externalInputLags;
    public final double stepSize;
    public final int horizon;
    public final boolean failOnSingular;
    public final double singularityThreshold;
    public final String dataFile;
    public final String separator;
    public final boolean header;

    /******************************************************************************
     * CONSTRUCTOR(S)
     ******************************************************************************/

    public ForecastConfig(Properties props) {

        try {
            this.autoregressiveLags = Integer.parseInt(props.getProperty("model.autoregressiveLags", "1"));
            this.externalInputLags = Integer.parseInt(props.getProperty("model.externalInputLags", "0"));
            this.stepSize = Double.parseDouble(props.getProperty("model.stepSize", "1.0"));
            this.horizon = Integer.parseInt(props.getProperty("forecast.horizon", "1"));
            this.failOnSingular = Boolean.parseBoolean(props.getProperty("forecast.failOnSingular", "false"));
            this.singularityThreshold = Double.parseDouble(props.getProperty(
                "estimator.singularityThreshold", String.valueOf(CoefficientEstimator.DEFAULT_SINGULARITY_THRESHOLD)));
            this.dataFile = props.getProperty("data.file", "sample.csv");
            this.separator = props.getProperty("data.separator", ",");
            this.header = Boolean.parseBoolean(props.getProperty("data.header", "true"));
        }
        catch (NumberFormatException e) {

            throw new IllegalStateException("Invalid forecast configuration: " + e.getMessage(), e);
        }
    }

    /******************************************************************************
     * INSTANCE BEHAVIOUR
     ******************************************************************************/

    public ModelParameters modelParameters() {

        return new ModelParameters(this.autoregressiveLags, this.externalInputLags, this.stepSize);
    }

    public CoefficientEstimator estimator() {

        return new CoefficientEstimator(this.singularityThreshold);
    }
}
