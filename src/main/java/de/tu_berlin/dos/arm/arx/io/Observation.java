package de.tu_berlin.dos.arm.arx.io;

import java.util.Objects;

public class Observation {

    public final double value;
    public final double input;

    public Observation(double value, double input) {

        this.value = value;
        this.input = input;
    }

    @Override
    public boolean equals(Object o) {

        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Observation that = (Observation) o;
        return Double.compare(value, that.value) == 0 && Double.compare(input, that.input) == 0;
    }

    @Override
    public int hashCode() {

        return Objects.hash(value, input);
    }

    @Override
    public String toString() {
        return "Observation{" +
                "value=" + value +
                ", input=" + input +
                '}';
    }
}
