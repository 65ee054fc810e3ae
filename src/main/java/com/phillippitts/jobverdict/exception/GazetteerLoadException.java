package com.phillippitts.jobverdict.exception;

/**
 * Thrown when the gazetteer tables cannot be read at startup.
 * This is a fatal error that prevents location validation from starting.
 */
public class GazetteerLoadException extends JobVerdictException {

    private final String resource;

    public GazetteerLoadException(String resource, String reason) {
        super("Gazetteer could not be loaded from " + resource + ": " + reason);
        this.resource = resource;
    }

    public GazetteerLoadException(String resource, Throwable cause) {
        super("Gazetteer could not be loaded from " + resource, cause);
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}
