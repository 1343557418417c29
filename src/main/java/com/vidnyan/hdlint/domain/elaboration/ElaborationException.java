package com.vidnyan.hdlint.domain.elaboration;

import com.vidnyan.hdlint.domain.model.Location;
import lombok.Getter;

/**
 * Fatal error while elaborating a top unit. Aborts that top unit only.
 */
@Getter
public class ElaborationException extends RuntimeException {

    public enum ErrorKind {
        UNKNOWN_UNIT,
        MISSING_ARCHITECTURE,
        UNRESOLVED_GENERIC,
        UNRESOLVED_REFERENCE,
        NON_INTEGER_GENERATE_BOUND,
        NON_CONSTANT_EXPRESSION,
        INSTANTIATION_CYCLE,
        ANALYSIS_LIMIT,
        INTERNAL_ERROR
    }

    private final ErrorKind kind;
    private final Location location;

    public ElaborationException(ErrorKind kind, String message, Location location) {
        super(message);
        this.kind = kind;
        this.location = location == null ? Location.UNKNOWN : location;
    }
}
