package org.configlex.language;

import org.configlex.scanner.LanguageConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds keywords and symbols that can never match because an earlier list entry always wins.
 * <p>
 * A symbol shadows every later symbol it is a proper prefix of. A keyword only shadows a later
 * keyword if the longer keyword continues with a character that passes the keyword boundary
 * check (for example {@code "end"} shadows {@code "end!"}, but not {@code "ending"}).
 */
public final class OrderingCheck {

    private OrderingCheck() {}

    /**
     * @param config The configuration to check.
     * @return One message per shadowed entry, empty if the ordering is sound.
     */
    public static List<String> findConflicts(LanguageConfig config) {
        List<String> conflicts = new ArrayList<>();
        collect("symbol", config.symbols(), false, conflicts);
        collect("keyword", config.keywords(), true, conflicts);
        return conflicts;
    }

    private static void collect(String kind, List<String> entries, boolean keywords, List<String> conflicts) {
        for (int later = 1; later < entries.size(); later++) {
            String candidate = entries.get(later);
            for (int earlier = 0; earlier < later; earlier++) {
                String prefix = entries.get(earlier);
                if (shadows(prefix, candidate, keywords)) {
                    conflicts.add(String.format("%s '%s' is listed before '%s' and shadows it", kind, prefix, candidate));
                    break;
                }
            }
        }
    }

    private static boolean shadows(String prefix, String candidate, boolean keywords) {
        if (prefix.length() >= candidate.length() || !candidate.startsWith(prefix)) {
            return false;
        }
        if (!keywords) {
            return true;
        }
        int next = candidate.codePointAt(prefix.length());
        return !(Character.isLetterOrDigit(next) && next < 128) && next != '_';
    }
}
