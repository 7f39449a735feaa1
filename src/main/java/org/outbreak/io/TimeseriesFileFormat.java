package org.outbreak.io;

import java.nio.file.Path;
import java.util.Locale;

/**
 * File formats supported for timeseries import and export, selected by file extension.
 */
public enum TimeseriesFileFormat {
    CSV(".csv"),
    JSON(".json");

    private final String extension;

    TimeseriesFileFormat(String extension) {
        this.extension = extension;
    }

    /**
     * Determines the format from a file name.
     * @param file The file.
     * @return The format.
     * @throws TimeseriesFormatException if the extension is neither .csv nor .json.
     */
    public static TimeseriesFileFormat forFile(Path file) throws TimeseriesFormatException {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        for (TimeseriesFileFormat format : values()) {
            if (name.endsWith(format.extension)) {
                return format;
            }
        }
        throw new TimeseriesFormatException("File must be .csv or .json: " + file);
    }
}
