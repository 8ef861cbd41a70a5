package de.tu_berlin.dos.arm.arx.modeling;

public class ParameterValidator {

    private ParameterValidator() {}

    public static void validate(ModelParameters params) {

        if (params == null) throw new InvalidParameterException("Model parameters must not be null");

        if (params.autoregressiveLags <= 0 || params.externalInputLags < 0) {

            throw new InvalidParameterException(String.format(
                "Lags must be positive integers, autoregressive lags: %d, external input lags: %d",
                params.autoregressiveLags, params.externalInputLags));
        }
        // written as a negated comparison so NaN is rejected as well
        if (!(params.stepSize > 0) || Double.isInfinite(params.stepSize)) {

            throw new InvalidParameterException("Step size must be a positive number, step size: " + params.stepSize);
        }
    }
}
