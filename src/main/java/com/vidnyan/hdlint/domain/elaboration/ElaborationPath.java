package com.vidnyan.hdlint.domain.elaboration;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Position of an instance or process below the top unit, e.g. {@code gen(3).u_add}.
 * The root path has no segments.
 */
public record ElaborationPath(List<Segment> segments) implements Comparable<ElaborationPath> {

    public static final ElaborationPath ROOT = new ElaborationPath(List.of());

    public ElaborationPath {
        segments = List.copyOf(segments);
    }

    /**
     * One step of the path: an instance label, or a generate label with its iteration index.
     */
    public record Segment(String label, Long index) implements Comparable<Segment> {

        public static Segment instance(String label) {
            return new Segment(label, null);
        }

        public static Segment generate(String label, long index) {
            return new Segment(label, index);
        }

        @Override
        public int compareTo(Segment other) {
            int byLabel = label.compareTo(other.label);
            if (byLabel != 0) return byLabel;
            if (index == null) return other.index == null ? 0 : -1;
            if (other.index == null) return 1;
            return Long.compare(index, other.index);
        }

        @Override
        public String toString() {
            return index == null ? label : label + "(" + index + ")";
        }
    }

    public ElaborationPath child(Segment segment) {
        List<Segment> extended = new ArrayList<>(segments);
        extended.add(segment);
        return new ElaborationPath(extended);
    }

    public ElaborationPath child(String instanceLabel) {
        return child(Segment.instance(instanceLabel));
    }

    /**
     * Render below a top unit: {@code top[gen(3).u_add]}.
     */
    public String format(String topUnit) {
        return topUnit + "[" + this + "]";
    }

    @Override
    public int compareTo(ElaborationPath other) {
        int common = Math.min(segments.size(), other.segments.size());
        for (int i = 0; i < common; i++) {
            int c = segments.get(i).compareTo(other.segments.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(segments.size(), other.segments.size());
    }

    @Override
    public String toString() {
        return segments.stream()
                .map(Segment::toString)
                .collect(Collectors.joining("."));
    }
}
