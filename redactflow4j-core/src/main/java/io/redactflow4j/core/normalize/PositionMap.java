/*
 * Copyright (c) 2025 Redactflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.redactflow4j.core.normalize;

import io.redactflow4j.core.api.model.Range;
import java.util.Arrays;
import java.util.BitSet;

/**
 * Maps offsets of the processed text back to offsets of the original text.
 *
 * <p>Every processed char points at the original char it came from, or at {@code -1}. Chars produced by a
 * transformation whose effect on length could not be tracked carry a proportional estimate and are flagged
 * approximate: {@link #mapRange} refuses to resolve ranges touching them, {@link #estimateRange} does not.
 */
public final class PositionMap {
    private final int[] origin;
    private final BitSet approximate;
    private final int originalLength;

    private PositionMap(int[] origin, BitSet approximate, int originalLength) {
        this.origin = origin;
        this.approximate = approximate;
        this.originalLength = originalLength;
    }

    public static PositionMap identity(int length) {
        int[] origin = new int[length];
        for (int i = 0; i < length; i++) origin[i] = i;
        return new PositionMap(origin, new BitSet(), length);
    }

    /**
     * Applies one transformation step.
     *
     * @param previousIndex for every char of the new text, the index it came from in the previous text or -1
     * @param stepApproximate chars of the new text whose {@code previousIndex} is only an estimate
     */
    public PositionMap compose(int[] previousIndex, BitSet stepApproximate) {
        int[] next = new int[previousIndex.length];
        BitSet approx = new BitSet(previousIndex.length);
        for (int i = 0; i < previousIndex.length; i++) {
            int p = previousIndex[i];
            if (p < 0 || p >= origin.length) {
                next[i] = -1;
                continue;
            }
            next[i] = origin[p];
            if (approximate.get(p) || stepApproximate.get(i)) approx.set(i);
        }
        return new PositionMap(next, approx, originalLength);
    }

    public int processedLength() {
        return origin.length;
    }

    public boolean hasApproximations() {
        return !approximate.isEmpty();
    }

    /** Exact original offset of a processed char, or -1. */
    public int mapPosition(int processed) {
        if (processed < 0 || processed >= origin.length || approximate.get(processed)) return -1;
        return origin[processed];
    }

    /** Exact original range, or {@link Range#UNMAPPABLE}. */
    public Range mapRange(int start, int end) {
        if (start < 0 || end < start || end > origin.length) return Range.UNMAPPABLE;
        if (start == end) {
            int p = pointAt(start, false);
            return p < 0 ? Range.UNMAPPABLE : new Range(p, p);
        }
        int touched = approximate.nextSetBit(start);
        if (touched >= 0 && touched < end) return Range.UNMAPPABLE;
        int os = origin[start];
        int last = origin[end - 1];
        if (os < 0 || last < 0 || last + 1 < os) return Range.UNMAPPABLE;
        return new Range(os, last + 1);
    }

    /** Best-effort original range, ignoring approximation flags; {@link Range#UNMAPPABLE} if no estimate exists. */
    public Range estimateRange(int start, int end) {
        if (start < 0 || end < start || end > origin.length) return Range.UNMAPPABLE;
        if (start == end) {
            int p = pointAt(start, true);
            return p < 0 ? Range.UNMAPPABLE : new Range(p, p);
        }
        int os = firstMapped(start, end);
        int oe = lastMapped(start, end);
        if (os < 0 || oe < 0) return Range.UNMAPPABLE;
        int s = Math.min(os, originalLength);
        int e = Math.min(Math.max(oe + 1, s), originalLength);
        return new Range(s, e);
    }

    private int pointAt(int processed, boolean allowApproximate) {
        if (processed < origin.length) {
            if (!allowApproximate && approximate.get(processed)) return -1;
            return origin[processed];
        }
        if (origin.length == 0) return originalLength == 0 ? 0 : -1;
        int prev = origin[origin.length - 1];
        if (prev < 0 || (!allowApproximate && approximate.get(origin.length - 1))) return -1;
        return prev + 1;
    }

    private int firstMapped(int start, int end) {
        for (int i = start; i < end; i++) if (origin[i] >= 0) return origin[i];
        return -1;
    }

    private int lastMapped(int start, int end) {
        for (int i = end - 1; i >= start; i--) if (origin[i] >= 0) return origin[i];
        return -1;
    }

    @Override
    public String toString() {
        return "PositionMap{origin=" + Arrays.toString(origin) + ", approximate=" + approximate + '}';
    }
}
