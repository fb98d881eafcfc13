package work.lcod.buildbackend.conda;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A conda package version with conda ordering rules: {@code dev} sorts before any other
 * string, strings sort before numbers and {@code post} sorts after everything.
 *
 * <p>Note: the natural ordering is inconsistent with {@link #equals(Object)}. Ordering pads
 * missing segments with zero, so {@code 1.0} and {@code 1.0.0} compare as equal, while equality
 * (and the printed form) keeps the text as written, ignoring case.
 */
public final class Version implements Comparable<Version> {
    private static final Pattern ALLOWED = Pattern.compile("[0-9a-z._+!*-]+");
    private static final Pattern RUNS = Pattern.compile("\\d+|[a-z]+|\\*");

    private final String source;
    private final long epoch;
    private final List<List<Object>> segments;
    private final List<List<Object>> local;

    private Version(String source, long epoch, List<List<Object>> segments, List<List<Object>> local) {
        this.source = source;
        this.epoch = epoch;
        this.segments = segments;
        this.local = local;
    }

    @JsonCreator
    public static Version parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("version must not be empty");
        }
        String trimmed = raw.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (!ALLOWED.matcher(lower).matches()) {
            throw new IllegalArgumentException("invalid version '" + raw + "'");
        }
        long epoch = 0;
        String rest = lower;
        int bang = rest.indexOf('!');
        if (bang >= 0) {
            try {
                epoch = Long.parseLong(rest.substring(0, bang));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("invalid epoch in version '" + raw + "'", ex);
            }
            rest = rest.substring(bang + 1);
        }
        String localPart = "";
        int plus = rest.indexOf('+');
        if (plus >= 0) {
            localPart = rest.substring(plus + 1);
            rest = rest.substring(0, plus);
        }
        if (rest.isEmpty()) {
            throw new IllegalArgumentException("invalid version '" + raw + "'");
        }
        return new Version(trimmed, epoch, split(rest, raw), localPart.isEmpty() ? List.of() : split(localPart, raw));
    }

    private static List<List<Object>> split(String value, String raw) {
        List<List<Object>> parts = new ArrayList<>();
        for (String segment : value.replace('-', '_').split("[._]", -1)) {
            if (segment.isEmpty()) {
                throw new IllegalArgumentException("empty segment in version '" + raw + "'");
            }
            List<Object> items = new ArrayList<>();
            var matcher = RUNS.matcher(segment);
            while (matcher.find()) {
                String run = matcher.group();
                if (Character.isDigit(run.charAt(0))) {
                    items.add(Long.parseLong(run));
                } else {
                    if (items.isEmpty()) {
                        items.add(0L);
                    }
                    items.add(run);
                }
            }
            parts.add(Collections.unmodifiableList(items));
        }
        return Collections.unmodifiableList(parts);
    }

    @Override
    public int compareTo(Version other) {
        int byEpoch = Long.compare(epoch, other.epoch);
        if (byEpoch != 0) {
            return byEpoch;
        }
        int bySegments = compareSegments(segments, other.segments);
        if (bySegments != 0) {
            return bySegments;
        }
        return compareSegments(local, other.local);
    }

    private static int compareSegments(List<List<Object>> left, List<List<Object>> right) {
        int length = Math.max(left.size(), right.size());
        for (int i = 0; i < length; i++) {
            List<Object> a = i < left.size() ? left.get(i) : List.of(0L);
            List<Object> b = i < right.size() ? right.get(i) : List.of(0L);
            int width = Math.max(a.size(), b.size());
            for (int j = 0; j < width; j++) {
                Object x = j < a.size() ? a.get(j) : 0L;
                Object y = j < b.size() ? b.get(j) : 0L;
                int cmp = compareItems(x, y);
                if (cmp != 0) {
                    return cmp;
                }
            }
        }
        return 0;
    }

    private static int compareItems(Object x, Object y) {
        int rankX = rank(x);
        int rankY = rank(y);
        if (rankX != rankY) {
            return Integer.compare(rankX, rankY);
        }
        if (x instanceof Long a && y instanceof Long b) {
            return Long.compare(a, b);
        }
        return x.toString().compareTo(y.toString());
    }

    private static int rank(Object item) {
        if (item instanceof Long) {
            return 3;
        }
        switch (item.toString()) {
            case "dev":
                return 0;
            case "post":
                return 4;
            case "*":
                return 1;
            default:
                return 2;
        }
    }

    @JsonValue
    @Override
    public String toString() {
        return source;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Version other && source.equalsIgnoreCase(other.source);
    }

    @Override
    public int hashCode() {
        return source.toLowerCase(Locale.ROOT).hashCode();
    }
}
