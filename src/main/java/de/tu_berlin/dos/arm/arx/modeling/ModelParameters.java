package de.tu_berlin.dos.arm.arx.modeling;

public class ModelParameters {

    // na, number of past values in the regression
    public final int autoregressiveLags;
    // nb, number of past inputs in the regression (in addition to the current one)
    public final int externalInputLags;
    // spacing between consecutive inputs, used to extrapolate the input axis
    public final double stepSize;

    public ModelParameters(int autoregressiveLags, int externalInputLags, double stepSize) {

        this.autoregressiveLags = autoregressiveLags;
        this.externalInputLags = externalInputLags;
        this.stepSize = stepSize;
    }

    /**
     * Minimum history needed before the first design row can be formed.
     */
    public int lagWindow() {

        return Math.max(this.autoregressiveLags, this.externalInputLags);
    }

    @Override
    public String toString() {
        return "ModelParameters{" +
                "autoregressiveLags=" + autoregressiveLags +
                ", externalInputLags=" + externalInputLags +
                ", stepSize=" + stepSize +
                '}';
    }
}
