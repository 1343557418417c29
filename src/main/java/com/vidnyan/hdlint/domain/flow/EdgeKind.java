package com.vidnyan.hdlint.domain.flow;

import java.util.Locale;

public enum EdgeKind {
    RISING,
    FALLING;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
