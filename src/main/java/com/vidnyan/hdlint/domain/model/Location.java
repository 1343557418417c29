package com.vidnyan.hdlint.domain.model;

import java.util.Comparator;

/**
 * Source location of a design construct, as reported by the front end.
 */
public record Location(
    String filePath,
    int line,
    int column
) implements Comparable<Location> {

    private static final Comparator<Location> ORDER = Comparator
            .comparing(Location::filePath, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingInt(Location::line)
            .thenComparingInt(Location::column);

    /**
     * Location used when the front end supplied none.
     */
    public static final Location UNKNOWN = new Location("<unknown>", 0, 0);

    public static Location at(String filePath, int line, int column) {
        return new Location(filePath, line, column);
    }

    /**
     * Format as readable string.
     */
    public String format() {
        return filePath + ":" + line + ":" + column;
    }

    @Override
    public int compareTo(Location other) {
        return ORDER.compare(this, other);
    }
}
