package io.github.nicechester.bibleimport.osis;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical order of the 66 Protestant canon books by OSIS identifier.
 * Books are ranked by this list rather than alphabetically or by encounter order.
 */
public final class CanonicalBookOrder {

    /**
     * Rank given to identifiers outside the canon; sorts after every real rank.
     */
    public static final int UNRANKED = 999;

    private static final List<String> OSIS_IDS = List.of(
        "Gen", "Exod", "Lev", "Num", "Deut", "Josh", "Judg", "Ruth", "1Sam", "2Sam",
        "1Kgs", "2Kgs", "1Chr", "2Chr", "Ezra", "Neh", "Esth", "Job", "Ps", "Prov",
        "Eccl", "Song", "Isa", "Jer", "Lam", "Ezek", "Dan", "Hos", "Joel", "Amos",
        "Obad", "Jonah", "Mic", "Nah", "Hab", "Zeph", "Hag", "Zech", "Mal", "Matt",
        "Mark", "Luke", "John", "Acts", "Rom", "1Cor", "2Cor", "Gal", "Eph", "Phil",
        "Col", "1Thess", "2Thess", "1Tim", "2Tim", "Titus", "Phlm", "Heb", "Jas",
        "1Pet", "2Pet", "1John", "2John", "3John", "Jude", "Rev"
    );

    private static final Map<String, Integer> RANKS = new HashMap<>();

    static {
        for (int i = 0; i < OSIS_IDS.size(); i++) {
            RANKS.put(OSIS_IDS.get(i), i + 1);
        }
    }

    private CanonicalBookOrder() {
    }

    /**
     * Returns the 1-based canonical rank of {@code osisId}, or {@link #UNRANKED}.
     */
    public static int rank(String osisId) {
        if (osisId == null) {
            return UNRANKED;
        }
        return RANKS.getOrDefault(osisId, UNRANKED);
    }

    public static boolean isCanonical(String osisId) {
        return osisId != null && RANKS.containsKey(osisId);
    }

    public static List<String> osisIds() {
        return OSIS_IDS;
    }
}
