package com.vidnyan.hdlint.domain.report;

import com.vidnyan.hdlint.domain.elaboration.ElaborationException;
import com.vidnyan.hdlint.domain.model.Location;

/**
 * Fatal error that aborted the analysis of one top unit.
 * Always error severity and never suppressible by rule configuration.
 */
public record ElaborationError(
    String topUnit,
    ElaborationException.ErrorKind kind,
    String message,
    Location location
) {

    public static ElaborationError from(String topUnit, ElaborationException e) {
        return new ElaborationError(topUnit, e.getKind(), e.getMessage(), e.getLocation());
    }
}
