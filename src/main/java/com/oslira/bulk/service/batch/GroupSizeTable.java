package com.oslira.bulk.service.batch;

import com.oslira.bulk.model.ComplexityClass;

import java.util.EnumMap;
import java.util.Map;

/**
 * Maximum group size per complexity class.
 *
 * <p>Heavier analyses hold a vendor slot longer, so they get smaller groups.
 * Classes without an entry use the fallback size.
 */
public final class GroupSizeTable {

    public static final int DEFAULT_FALLBACK_SIZE = 10;

    private final Map<ComplexityClass, Integer> sizes;
    private final int fallbackSize;

    public GroupSizeTable(Map<ComplexityClass, Integer> sizes, int fallbackSize) {
        requirePositive("fallback", fallbackSize);
        EnumMap<ComplexityClass, Integer> copy = new EnumMap<>(ComplexityClass.class);
        sizes.forEach((complexity, size) -> {
            requirePositive(complexity.code(), size);
            copy.put(complexity, size);
        });
        this.sizes = copy;
        this.fallbackSize = fallbackSize;
    }

    /**
     * light=8, deep=5, xray=3, fallback=10.
     */
    public static GroupSizeTable defaults() {
        return new GroupSizeTable(Map.of(
                ComplexityClass.LIGHT, 8,
                ComplexityClass.DEEP, 5,
                ComplexityClass.XRAY, 3
        ), DEFAULT_FALLBACK_SIZE);
    }

    public int groupSizeFor(ComplexityClass complexity) {
        if (complexity == null) {
            return fallbackSize;
        }
        return sizes.getOrDefault(complexity, fallbackSize);
    }

    public int fallbackSize() {
        return fallbackSize;
    }

    private static void requirePositive(String name, Integer size) {
        if (size == null || size < 1) {
            throw new IllegalArgumentException("group size for " + name + " must be >= 1, was " + size);
        }
    }

    @Override
    public String toString() {
        return "GroupSizeTable" + sizes + " fallback=" + fallbackSize;
    }
}
