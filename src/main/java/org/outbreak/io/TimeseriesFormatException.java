package org.outbreak.io;

/**
 * Thrown when timeseries data cannot be read or written because of its structure, e.g. a JSON document
 * that is not an array, a CSV file without data rows or an unsupported file extension.
 * Individual unparsable numeric fields are not structural errors; they are read as zero.
 */
public class TimeseriesFormatException extends Exception {

    /**
     * Constructs a new format exception with the specified detail message.
     * @param message The detail message.
     */
    public TimeseriesFormatException(String message) {
        super(message);
    }

    /**
     * Constructs a new format exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public TimeseriesFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
