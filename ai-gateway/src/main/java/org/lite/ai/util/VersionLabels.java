package org.lite.ai.util;

import java.math.BigInteger;
import java.util.Collection;
import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordering and allocation of semantic version labels ("major.minor.patch", optional "-suffix").
 */
public final class VersionLabels {

    private static final Pattern SEMVER = Pattern.compile("^(\\d+)\\.(\\d+)\\.(\\d+)(?:-.+)?$");

    public static final Comparator<String> ORDER = VersionLabels::compare;

    private VersionLabels() {
    }

    public static boolean isSemantic(String label) {
        return label != null && SEMVER.matcher(label).matches();
    }

    /**
     * Semantic labels order numerically and before any non-semantic label, which order lexically.
     */
    public static int compare(String a, String b) {
        Matcher ma = SEMVER.matcher(a);
        Matcher mb = SEMVER.matcher(b);
        boolean sa = ma.matches();
        boolean sb = mb.matches();
        if (sa && sb) {
            for (int i = 1; i <= 3; i++) {
                int cmp = Long.compare(Long.parseLong(ma.group(i)), Long.parseLong(mb.group(i)));
                if (cmp != 0) {
                    return cmp;
                }
            }
            return a.compareTo(b);
        }
        if (sa != sb) {
            return sa ? -1 : 1;
        }
        return a.compareTo(b);
    }

    /**
     * Like {@link #compare} but plain integer labels ("1", "12") also order numerically.
     */
    public static int compareLoose(String a, String b) {
        if (a.matches("\\d+") && b.matches("\\d+")) {
            return new BigInteger(a).compareTo(new BigInteger(b));
        }
        return compare(a, b);
    }

    /**
     * Next patch label after the highest semantic label in {@code existing}; "1.0.0" when there is none.
     */
    public static String nextPatch(Collection<String> existing) {
        String highest = existing.stream()
                .filter(VersionLabels::isSemantic)
                .max(ORDER)
                .orElse(null);
        if (highest == null) {
            return "1.0.0";
        }
        Matcher m = SEMVER.matcher(highest);
        if (!m.matches()) {
            return "1.0.0";
        }
        return m.group(1) + "." + m.group(2) + "." + (Long.parseLong(m.group(3)) + 1);
    }
}
