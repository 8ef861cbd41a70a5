package de.tu_berlin.dos.arm.arx.modeling;

public class InvalidParameterException extends IllegalArgumentException {

    public InvalidParameterException(String message) {

        super(message);
    }
}
