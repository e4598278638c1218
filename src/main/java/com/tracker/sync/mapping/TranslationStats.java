package com.tracker.sync.mapping;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counts how source values were translated into destination options, per field.
 */
public class TranslationStats {

    private final Map<String, Map<Translation, LongAdder>> counts = new ConcurrentHashMap<>();

    public void record(String field, String from, String to) {
        counts.computeIfAbsent(field, f -> new ConcurrentHashMap<>())
                .computeIfAbsent(new Translation(from, to), t -> new LongAdder())
                .increment();
    }

    /**
     * Snapshot sorted by field, then source value.
     */
    public Map<String, Map<Translation, Long>> snapshot() {
        Map<String, Map<Translation, Long>> result = new TreeMap<>();
        counts.forEach((field, byTranslation) -> {
            Map<Translation, Long> sorted = new TreeMap<>();
            byTranslation.forEach((t, n) -> sorted.put(t, n.sum()));
            result.put(field, sorted);
        });
        return result;
    }

    public long count(String field, String from, String to) {
        Map<Translation, LongAdder> byTranslation = counts.get(field);
        if (byTranslation == null) {
            return 0;
        }
        LongAdder n = byTranslation.get(new Translation(from, to));
        return n == null ? 0 : n.sum();
    }

    /**
     * One source value and the option it became ({@code to} is null on a miss).
     */
    public record Translation(String from, String to) implements Comparable<Translation> {
        @Override
        public int compareTo(Translation o) {
            int c = String.valueOf(from).compareTo(String.valueOf(o.from));
            return c != 0 ? c : String.valueOf(to).compareTo(String.valueOf(o.to));
        }

        @Override
        public String toString() {
            return from + " -> " + to;
        }
    }
}
