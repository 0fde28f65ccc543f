package com.example.fileingest;

/**
 * Missing or invalid configuration. Fatal to starting a crawl.
 */
public class ConfigurationException extends IngestException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
