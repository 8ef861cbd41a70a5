package de.tu_berlin.dos.arm.arx.utils;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Properties;

public enum FileReader { GET;

    /**
     * Loads a classpath resource either as {@link Properties} or as an open {@link InputStream},
     * which the caller has to close.
     */
    public <T> T read(String fileName, Class<T> clazz) throws IOException {

        ClassLoader classLoader = FileReader.class.getClassLoader();
        URL resource = classLoader.getResource(fileName);
        if (resource == null) throw new IOException("Resource not found on classpath: " + fileName);

        if (clazz == Properties.class) {

            Properties props = new Properties();
            try (InputStream input = resource.openStream()) {
                props.load(input);
            }
            return clazz.cast(props);
        }
        else if (clazz == InputStream.class) {

            return clazz.cast(resource.openStream());
        }
        throw new IllegalArgumentException("Unsupported resource type: " + clazz.getName());
    }
}
