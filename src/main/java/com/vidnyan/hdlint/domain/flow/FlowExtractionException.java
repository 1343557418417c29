package com.vidnyan.hdlint.domain.flow;

import com.vidnyan.hdlint.domain.model.Location;
import lombok.Getter;

/**
 * A process exceeded the configured analysis limits.
 */
@Getter
public class FlowExtractionException extends RuntimeException {

    private final Location location;

    public FlowExtractionException(String message, Location location) {
        super(message);
        this.location = location;
    }
}
