package org.carball.tangle.model.construct;

import java.util.Comparator;

/**
 * Opaque source reference carried for reporting only. Never used for scoring.
 */
public record SourceLocation(String file, int line, int column) implements Comparable<SourceLocation> {

    private static final SourceLocation UNKNOWN = new SourceLocation("", 0, 0);

    private static final Comparator<SourceLocation> ORDER = Comparator
            .comparing(SourceLocation::file)
            .thenComparingInt(SourceLocation::line)
            .thenComparingInt(SourceLocation::column);

    public SourceLocation {
        file = file == null ? "" : file;
    }

    public static SourceLocation unknown() {
        return UNKNOWN;
    }

    public static SourceLocation of(String file, int line) {
        return new SourceLocation(file, line, 0);
    }

    public boolean isUnknown() {
        return file.isEmpty() && line == 0 && column == 0;
    }

    @Override
    public int compareTo(SourceLocation other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        if (isUnknown()) {
            return "<unknown>";
        }
        return column > 0 ? file + ":" + line + ":" + column : file + ":" + line;
    }
}
