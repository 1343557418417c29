package com.vidnyan.hdlint.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Component instantiation with generic and port maps (formal name to actual expression).
 */
public record Instantiation(
    String label,
    String unitName,
    Map<String, Expression> genericMap,
    Map<String, Expression> portMap,
    Location location
) implements ConcurrentStatement {

    public Instantiation {
        genericMap = Collections.unmodifiableMap(new LinkedHashMap<>(genericMap));
        portMap = Collections.unmodifiableMap(new LinkedHashMap<>(portMap));
        location = location == null ? Location.UNKNOWN : location;
    }

    @Override
    public Kind kind() {
        return Kind.INSTANTIATION;
    }
}
