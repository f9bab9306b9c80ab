package com.strollie.planner.scoring;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.function.Function;

/**
 * Reorders a sequence so that no category repeats more than {@code maxConsecutive} times in a row,
 * as far as the mix of categories allows.
 */
public final class CategoryDiversity {

    private CategoryDiversity() {
    }

    public static <T> List<T> rebalance(List<T> items, int maxConsecutive, Function<T, String> categoryOf) {
        if (items.size() <= 1 || maxConsecutive <= 0) {
            return new ArrayList<>(items);
        }
        LinkedList<T> pending = new LinkedList<>(items);
        List<T> result = new ArrayList<>(items.size());

        while (!pending.isEmpty()) {
            boolean added = false;
            Iterator<T> it = pending.iterator();
            while (it.hasNext()) {
                T item = it.next();
                if (streak(result, category(item, categoryOf), categoryOf) < maxConsecutive) {
                    result.add(item);
                    it.remove();
                    added = true;
                    break;
                }
            }
            if (!added) {
                result.add(pending.removeFirst());
            }
        }
        return result;
    }

    private static <T> int streak(List<T> sequence, String category, Function<T, String> categoryOf) {
        int streak = 0;
        for (int i = sequence.size() - 1; i >= 0; i--) {
            if (!category(sequence.get(i), categoryOf).equals(category)) {
                break;
            }
            streak++;
        }
        return streak;
    }

    private static <T> String category(T item, Function<T, String> categoryOf) {
        String category = categoryOf.apply(item);
        return category == null ? "unknown" : category;
    }
}
