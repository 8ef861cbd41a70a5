package de.tu_berlin.dos.arm.arx.io;

import org.apache.log4j.Logger;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

public enum FileParser { GET;

    public static final Logger LOG = Logger.getLogger(FileParser.class);

    /**
     * Reads a time series from a file where every line holds {@code value<sep>input}. Lines that
     * cannot be parsed are logged and skipped.
     */
    public TimeSeries fromCSV(File file, String sep, boolean header) throws IOException {

        try (BufferedReader br = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            return parse(br, file.getName(), sep, header);
        }
    }

    public TimeSeries fromCSV(InputStream input, String source, String sep, boolean header) throws IOException {

        try (BufferedReader br = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            return parse(br, source, sep, header);
        }
    }

    private TimeSeries parse(BufferedReader br, String source, String sep, boolean header) throws IOException {

        List<Observation> observations = new ArrayList<>();
        String line;
        int lineNumber = 0;
        boolean headerRead = false;
        while ((line = br.readLine()) != null) {
            lineNumber++;
            if (header && !headerRead) {
                headerRead = true;
                continue;
            }
            if (line.trim().isEmpty()) continue;

            String[] values = line.split(sep);
            try {
                observations.add(new Observation(Double.parseDouble(values[0].trim()), Double.parseDouble(values[1].trim())));
            }
            catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {

                LOG.warn("Skipping line " + lineNumber + " of " + source + ": " + e.getMessage());
            }
        }
        LOG.debug("Read " + observations.size() + " observations from " + source);
        return TimeSeries.of(observations);
    }
}
