package org.schedstore.store.migration;

import org.schedstore.store.api.IntParseException;

/**
 * Offset window over the messages table, {@code [from, to)}.
 *
 * @param from first offset, inclusive
 * @param to end offset, exclusive; {@code null} means end of table
 */
public record OffsetRange(long from, Long to) {

    public OffsetRange {
        if (from < 0) {
            throw new IllegalArgumentException("from must not be negative: " + from);
        }
        if (to != null && to < from) {
            throw new IllegalArgumentException("to (" + to + ") must not be before from (" + from + ")");
        }
    }

    /**
     * Parses {@code "<from>"} or {@code "<from>-<to>"}.
     *
     * @throws IntParseException if either bound is not a non-negative integer or to &lt; from
     */
    public static OffsetRange parse(String text) throws IntParseException {
        if (text == null || text.isBlank()) {
            throw new IntParseException("data store int error: empty range");
        }
        String[] parts = text.trim().split("-", 2);
        try {
            long from = Long.parseLong(parts[0].trim());
            Long to = parts.length > 1 ? Long.valueOf(parts[1].trim()) : null;
            return new OffsetRange(from, to);
        } catch (NumberFormatException e) {
            throw new IntParseException("data store int error: invalid range '" + text + "': " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new IntParseException("data store int error: " + e.getMessage(), e);
        }
    }

    /**
     * Number of rows this range covers in a table of {@code rowCount} rows.
     * {@code to} is clamped to the row count.
     */
    public long rowsWithin(long rowCount) {
        long end = to != null ? Math.min(to, rowCount) : rowCount;
        return Math.max(end - from, 0L);
    }

    @Override
    public String toString() {
        return to != null ? from + "-" + to : Long.toString(from);
    }
}
