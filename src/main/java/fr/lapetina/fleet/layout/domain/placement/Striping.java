package fr.lapetina.fleet.layout.domain.placement;

import java.util.ArrayList;
import java.util.List;

/**
 * Interleaves ordered groups so that consecutive elements come from different
 * groups whenever possible.
 */
public final class Striping {

    private Striping() {
        // Utility class
    }

    /**
     * Returns element 0 of every group, then element 1 of every group, and so
     * on. Groups that run out are skipped.
     *
     * <pre>{@code
     * stripe([[a1, a2, a3], [b1], [c1, c2]]) = [a1, b1, c1, a2, c2, a3]
     * }</pre>
     */
    public static <T> List<T> stripe(List<? extends List<? extends T>> groups) {
        int longest = 0;
        int total = 0;
        for (List<? extends T> group : groups) {
            longest = Math.max(longest, group.size());
            total += group.size();
        }

        List<T> striped = new ArrayList<>(total);
        for (int i = 0; i < longest; i++) {
            for (List<? extends T> group : groups) {
                if (i < group.size()) {
                    striped.add(group.get(i));
                }
            }
        }
        return striped;
    }
}
