package com.outcast.rivalry.model;

import java.util.stream.IntStream;

/** Inclusive range of weeks; empty when {@code last < first}. */
public record WeekRange(int first, int last) {

    public static WeekRange none() {
        return new WeekRange(1, 0);
    }

    public static WeekRange through(int last) {
        return new WeekRange(1, last);
    }

    public boolean isEmpty() {
        return last < first;
    }

    public int size() {
        return isEmpty() ? 0 : last - first + 1;
    }

    public IntStream weeks() {
        return isEmpty() ? IntStream.empty() : IntStream.rangeClosed(first, last);
    }
}
