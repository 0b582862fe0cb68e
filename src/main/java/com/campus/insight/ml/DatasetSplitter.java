package com.campus.insight.ml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

/**
 * Seeded train/test splits over row indices. At least one row always stays in the training split.
 */
public final class DatasetSplitter {

    public record Split(int[] train, int[] test) {}

    private DatasetSplitter() {}

    public static Split random(int rows, double testFraction, long seed) {
        List<Integer> order = shuffled(indices(rows), seed);
        int testSize = testSize(rows, testFraction);
        return new Split(toArray(order.subList(testSize, rows)), toArray(order.subList(0, testSize)));
    }

    /**
     * Each class contributes {@code round(classSize * testFraction)} rows to the test split, keeping
     * class proportions in both halves.
     */
    public static Split stratified(int[] labels, double testFraction, long seed) {
        Map<Integer, List<Integer>> byClass = new TreeMap<>();
        for (int i = 0; i < labels.length; i++) {
            byClass.computeIfAbsent(labels[i], k -> new ArrayList<>()).add(i);
        }
        List<Integer> train = new ArrayList<>();
        List<Integer> test = new ArrayList<>();
        Random random = new Random(seed);
        for (List<Integer> members : byClass.values()) {
            Collections.shuffle(members, random);
            int take = (int) Math.round(members.size() * testFraction);
            take = Math.min(take, members.size() - 1);
            test.addAll(members.subList(0, take));
            train.addAll(members.subList(take, members.size()));
        }
        Collections.sort(train);
        Collections.sort(test);
        return new Split(toArray(train), toArray(test));
    }

    static int testSize(int rows, double testFraction) {
        if (rows < 2) return 0;
        int size = (int) Math.ceil(rows * testFraction);
        return Math.min(size, rows - 1);
    }

    private static List<Integer> indices(int n) {
        List<Integer> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) out.add(i);
        return out;
    }

    private static List<Integer> shuffled(List<Integer> values, long seed) {
        Collections.shuffle(values, new Random(seed));
        return values;
    }

    private static int[] toArray(List<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).toArray();
    }
}
