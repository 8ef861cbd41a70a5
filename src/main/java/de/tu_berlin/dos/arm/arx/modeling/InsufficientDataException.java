package de.tu_berlin.dos.arm.arx.modeling;

public class InsufficientDataException extends IllegalStateException {

    private final int available;
    private final int required;

    public InsufficientDataException(int available, int required) {

        super("Not enough data points for prediction, need at least " + required + " but got " + available);
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {

        return available;
    }

    public int getRequired() {

        return required;
    }
}
