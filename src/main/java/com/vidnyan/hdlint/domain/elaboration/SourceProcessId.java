package com.vidnyan.hdlint.domain.elaboration;

import com.vidnyan.hdlint.domain.model.Location;

/**
 * Identity of a process in the source, shared by every elaborated copy of it.
 */
public record SourceProcessId(
    String unitName,
    String architectureName,
    String label,
    Location location
) {

    @Override
    public String toString() {
        return unitName + "(" + architectureName + ")." + label;
    }
}
