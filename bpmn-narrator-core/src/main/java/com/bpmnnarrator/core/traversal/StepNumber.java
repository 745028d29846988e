package com.bpmnnarrator.core.traversal;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Hierarchical step number such as {@code 3}, {@code 3.1} or {@code 3.1.2}.
 *
 * <p>Numbers compare part by part; a prefix sorts before its children, so {@code 3 < 3.1 < 3.2 < 4}.
 *
 * @param parts number parts, outermost first; never empty, all positive
 */
public record StepNumber(List<Integer> parts) implements Comparable<StepNumber> {

    public StepNumber {
        Objects.requireNonNull(parts, "parts must not be null");
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("parts must not be empty");
        }
        if (parts.stream().anyMatch(p -> p == null || p < 1)) {
            throw new IllegalArgumentException("parts must be positive: " + parts);
        }
        parts = List.copyOf(parts);
    }

    public static StepNumber of(int... parts) {
        List<Integer> list = new ArrayList<>(parts.length);
        for (int part : parts) {
            list.add(part);
        }
        return new StepNumber(list);
    }

    /**
     * Parses a dotted number.
     *
     * @param text number such as {@code "2.1"}
     * @return parsed number
     * @throws IllegalArgumentException if the text is not a dotted positive number
     */
    public static StepNumber parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        List<Integer> list = new ArrayList<>();
        for (String part : text.trim().split("\\.")) {
            try {
                list.add(Integer.parseInt(part));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid step number: " + text, e);
            }
        }
        return new StepNumber(list);
    }

    /**
     * Returns the following sibling: the last part incremented.
     */
    public StepNumber next() {
        List<Integer> list = new ArrayList<>(parts);
        list.set(list.size() - 1, list.get(list.size() - 1) + 1);
        return new StepNumber(list);
    }

    /**
     * Returns a child number {@code this.index}.
     *
     * @param index child index, starting at 1
     */
    public StepNumber child(int index) {
        List<Integer> list = new ArrayList<>(parts);
        list.add(index);
        return new StepNumber(list);
    }

    /**
     * Returns the nesting depth: 0 for top-level numbers.
     */
    public int depth() {
        return parts.size() - 1;
    }

    @Override
    public int compareTo(StepNumber other) {
        int shared = Math.min(parts.size(), other.parts.size());
        for (int i = 0; i < shared; i++) {
            int cmp = Integer.compare(parts.get(i), other.parts.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(parts.size(), other.parts.size());
    }

    @Override
    public String toString() {
        return parts.stream().map(String::valueOf).collect(Collectors.joining("."));
    }
}
