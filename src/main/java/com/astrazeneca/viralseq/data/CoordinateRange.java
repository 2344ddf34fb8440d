package com.astrazeneca.viralseq.data;

import java.util.Objects;

/**
 * Closed range of reference coordinates, used to check where located sequences start and end.
 */
public class CoordinateRange {
    public final int from;
    public final int to;

    public CoordinateRange(int from, int to) {
        if (from > to) {
            throw new IllegalArgumentException("Range start " + from + " is after its end " + to);
        }
        this.from = from;
        this.to = to;
    }

    public static CoordinateRange single(int position) {
        return new CoordinateRange(position, position);
    }

    /**
     * Parses range from command line value: single position "4384" or range "4384-4386".
     * @param value string value
     * @return parsed range
     */
    public static CoordinateRange parse(String value) {
        String[] parts = value.trim().split("-");
        try {
            if (parts.length == 1) {
                return single(Integer.parseInt(parts[0]));
            } else if (parts.length == 2) {
                return new CoordinateRange(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Wrong format of coordinate range \"" + value
                    + "\", must be position or start-end", e);
        }
        throw new IllegalArgumentException("Wrong format of coordinate range \"" + value
                + "\", must be position or start-end");
    }

    public boolean contains(int position) {
        return position >= from && position <= to;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CoordinateRange that = (CoordinateRange) o;
        return from == that.from && to == that.to;
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to);
    }

    @Override
    public String toString() {
        return from == to ? String.valueOf(from) : from + "-" + to;
    }
}
