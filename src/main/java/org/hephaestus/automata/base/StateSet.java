package org.hephaestus.automata.base;

import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * 状态下标的有序集合，子集构造中"新状态 = 旧状态集合"的值对象。
 * 内部是升序去重的 int 数组，因此 equals / hashCode 与插入顺序无关。
 * 此类是不可变的。
 */
public final class StateSet implements Comparable<StateSet>, Iterable<Integer> {

    public static final StateSet EMPTY = new StateSet(new int[0]);

    // 升序且无重复
    private final int[] states;

    private final int hashCode;

    private StateSet(int[] sortedDistinct) {
        this.states = sortedDistinct;
        this.hashCode = Arrays.hashCode(sortedDistinct);
    }

    public static StateSet of(int... states) {
        if (states.length == 0) {
            return EMPTY;
        }
        return new StateSet(IntStream.of(states).sorted().distinct().toArray());
    }

    public static StateSet of(Collection<Integer> states) {
        Objects.requireNonNull(states, "States collection cannot be null");
        if (states.isEmpty()) {
            return EMPTY;
        }
        return new StateSet(states.stream().mapToInt(Integer::intValue).sorted().distinct().toArray());
    }

    /**
     * 合并两个有序集合。
     * @param other 另一个状态集合。
     * @return 并集，任一方为空时直接返回另一方。
     */
    public StateSet union(StateSet other) {
        if (other.isEmpty()) {
            return this;
        }
        if (this.isEmpty()) {
            return other;
        }
        int[] merged = new int[this.states.length + other.states.length];
        int i = 0;
        int j = 0;
        int k = 0;
        while (i < states.length && j < other.states.length) {
            int a = states[i];
            int b = other.states[j];
            if (a < b) {
                merged[k++] = a;
                i++;
            } else if (b < a) {
                merged[k++] = b;
                j++;
            } else {
                merged[k++] = a;
                i++;
                j++;
            }
        }
        while (i < states.length) {
            merged[k++] = states[i++];
        }
        while (j < other.states.length) {
            merged[k++] = other.states[j++];
        }
        return new StateSet(Arrays.copyOf(merged, k));
    }

    public boolean contains(int state) {
        return Arrays.binarySearch(states, state) >= 0;
    }

    /**
     * 检查此集合是否与给定集合有公共元素。
     */
    public boolean intersects(Collection<Integer> others) {
        for (int state : states) {
            if (others.contains(state)) {
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return states.length == 0;
    }

    public int size() {
        return states.length;
    }

    public IntStream stream() {
        return Arrays.stream(states);
    }

    public SortedSet<Integer> toSortedSet() {
        return stream().boxed().collect(Collectors.toCollection(TreeSet::new));
    }

    @Override
    public Iterator<Integer> iterator() {
        return new Iterator<>() {
            private int cursor = 0;

            @Override
            public boolean hasNext() {
                return cursor < states.length;
            }

            @Override
            public Integer next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return states[cursor++];
            }
        };
    }

    @Override
    public int compareTo(StateSet other) {
        // 逐个元素比较，前缀较短者更小
        int common = Math.min(this.states.length, other.states.length);
        for (int i = 0; i < common; i++) {
            int cmp = Integer.compare(this.states[i], other.states[i]);
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(this.states.length, other.states.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StateSet that = (StateSet) o;
        return Arrays.equals(states, that.states);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return stream().mapToObj(String::valueOf).collect(Collectors.joining(", ", "{", "}"));
    }
}
