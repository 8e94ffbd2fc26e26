package org.nowstart.finpack.strategy.core;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Date to buy-pipeline output for every simulated day so far, in chronological order.
 */
public final class SelectionHistory {

    private final LinkedHashMap<LocalDate, List<String>> selections = new LinkedHashMap<>();

    public void append(LocalDate date, List<String> selected) {
        selections.put(date, List.copyOf(selected));
    }

    public int size() {
        return selections.size();
    }

    public List<String> on(LocalDate date) {
        List<String> selected = selections.get(date);
        return selected == null ? List.of() : selected;
    }

    /**
     * The last {@code periods} selections, oldest first; fewer when the history is shorter.
     */
    public List<List<String>> recent(int periods) {
        List<List<String>> all = new ArrayList<>(selections.values());
        return all.subList(Math.max(0, all.size() - periods), all.size());
    }

    public Map<LocalDate, List<String>> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(selections));
    }
}
