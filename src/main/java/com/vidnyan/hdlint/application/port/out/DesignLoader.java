package com.vidnyan.hdlint.application.port.out;

import com.vidnyan.hdlint.domain.model.Design;

import java.nio.file.Path;

/**
 * Port for the front end: turns a design description into the structural model.
 * Implementations throw {@link DesignLoadException} on malformed input.
 */
public interface DesignLoader {

    Design load(Path path);

    /**
     * Raised when a design description cannot be read or does not describe a valid design.
     */
    class DesignLoadException extends RuntimeException {

        public DesignLoadException(String message) {
            super(message);
        }

        public DesignLoadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
