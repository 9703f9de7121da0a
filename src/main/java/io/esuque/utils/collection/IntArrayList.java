package io.esuque.utils.collection;

import com.koloboke.collect.IntCollection;
import com.koloboke.collect.IntCursor;
import com.koloboke.collect.IntIterator;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.Collection;
import java.util.ConcurrentModificationException;
import java.util.NoSuchElementException;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.IntPredicate;
import java.util.function.Predicate;

public class IntArrayList implements IntCollection {
    private static final int INITIAL_SIZE = 16;

    private int[] backingArray;
    private int numElements;

    public IntArrayList() {
        this(INITIAL_SIZE);
    }

    public IntArrayList(int capacity) {
        ensureCapacity(capacity);
        this.numElements = 0;
    }

    public IntArrayList(IntArrayList intArrayList) {
        this(intArrayList.backingArray, intArrayList.numElements);
    }

    public IntArrayList(int[] intArray, int numElements) {
        this.numElements = numElements;
        backingArray = Arrays.copyOf(intArray, Math.max(numElements, 1));
    }

    public static IntArrayList of(int... elements) {
        return new IntArrayList(elements, elements.length);
    }

    @Override
    public int size() {
        return numElements;
    }

    @Override
    public long sizeAsLong() {
        return numElements;
    }

    @Override
    public boolean ensureCapacity(long l) {
        if (l > Integer.MAX_VALUE) {
            throw new UnsupportedOperationException("IntArrayList does not support long sizes yet");
        }

        int minimumSize = (int) l;

        if (backingArray == null) {
            backingArray = new int[Math.max(minimumSize, 1)];
        }
        else if (minimumSize > backingArray.length) {
            int targetLength = Math.max(backingArray.length, 1);

            while (targetLength < minimumSize) {
                targetLength = targetLength << 1;

                if (targetLength < 0) {
                    targetLength = minimumSize;
                    break;
                }
            }

            backingArray = Arrays.copyOf(backingArray, targetLength);
        }
        else {
            return false;
        }

        return true;
    }

    @Override
    public boolean shrink() {
        if (backingArray.length == numElements || numElements == 0) {
            return false;
        }

        backingArray = Arrays.copyOf(backingArray, numElements);
        return true;
    }

    @Override
    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public boolean contains(Object o) {
        return o instanceof Integer && contains((int) (Integer) o);
    }

    @Override
    public boolean contains(int element) {
        return indexOf(element) >= 0;
    }

    public int indexOf(int element) {
        for (int i = 0; i < numElements; ++i) {
            if (backingArray[i] == element) {
                return i;
            }
        }

        return -1;
    }

    @Nonnull
    @Override
    public Object[] toArray() {
        return toArray(new Integer[numElements]);
    }

    @Nonnull
    @Override
    public <T> T[] toArray(@Nonnull T[] ts) {
        if (ts.length < numElements) {
            ts = Arrays.copyOf(ts, numElements);
        }

        for (int i = 0; i < numElements; ++i) {
            ts[i] = (T) Integer.valueOf(backingArray[i]);
        }

        if (ts.length > numElements) {
            ts[numElements] = null;
        }

        return ts;
    }

    @Nonnull
    @Override
    public int[] toIntArray() {
        return Arrays.copyOf(backingArray, numElements);
    }

    @Nonnull
    @Override
    public int[] toArray(@Nonnull int[] ints) {
        if (ints.length < numElements) {
            return toIntArray();
        }

        System.arraycopy(backingArray, 0, ints, 0, numElements);

        return ints;
    }

    @Nonnull
    @Override
    public IntCursor cursor() {
        return new IntArrayListCursor();
    }

    @Nonnull
    @Override
    public IntIterator iterator() {
        return new IntArrayListIterator();
    }

    @Override
    public void forEach(@Nonnull IntConsumer intConsumer) {
        for (int i = 0; i < numElements; ++i) {
            intConsumer.accept(backingArray[i]);
        }
    }

    @Override
    public void forEach(@Nonnull Consumer<? super Integer> intConsumer) {
        for (int i = 0; i < numElements; ++i) {
            intConsumer.accept(backingArray[i]);
        }
    }

    @Override
    public boolean forEachWhile(@Nonnull IntPredicate intPredicate) {
        for (int i = 0; i < numElements; ++i) {
            if (!intPredicate.test(backingArray[i])) {
                return false;
            }
        }

        return true;
    }

    @Override
    public boolean add(@Nonnull Integer integer) {
        return add((int) integer);
    }

    @Override
    public boolean add(int newValue) {
        ensureCanAddNElements(1);
        backingArray[numElements++] = newValue;
        return true;
    }

    /**
     * Appends {@code newValue} unless it is already in the list.
     *
     * @return true if the value was appended.
     */
    public boolean addIfAbsent(int newValue) {
        if (contains(newValue)) {
            return false;
        }

        return add(newValue);
    }

    @Override
    public boolean remove(Object o) {
        return o instanceof Integer && removeInt((Integer) o);
    }

    @Override
    public boolean containsAll(@Nonnull Collection<?> c) {
        for (Object o : c) {
            if (!contains(o)) {
                return false;
            }
        }

        return true;
    }

    @Override
    public boolean addAll(@Nonnull Collection<? extends Integer> c) {
        if (c.isEmpty()) {
            return false;
        }

        ensureCanAddNElements(c.size());

        for (int o : c) {
            add(o);
        }

        return true;
    }

    public boolean addAll(IntArrayList other) {
        if (other == null || other.isEmpty()) {
            return false;
        }

        ensureCanAddNElements(other.numElements);
        System.arraycopy(other.backingArray, 0, backingArray, numElements, other.numElements);
        numElements += other.numElements;

        return true;
    }

    @Override
    public boolean removeAll(@Nonnull Collection<?> c) {
        return removeBasedOnCollection(c, true);
    }

    @Override
    public boolean retainAll(@Nonnull Collection<?> c) {
        return removeBasedOnCollection(c, false);
    }

    private boolean removeBasedOnCollection(Collection<?> c, boolean ifPresent) {
        boolean removedAtLeastOne = false;

        for (int i = numElements - 1; i >= 0; --i) {
            int e = backingArray[i];

            if (ifPresent == c.contains(e)) {
                remove(i);
                removedAtLeastOne = true;
            }
        }

        return removedAtLeastOne;
    }

    @Override
    public boolean removeInt(int targetValue) {
        int index = indexOf(targetValue);

        if (index < 0) {
            return false;
        }

        remove(index);
        return true;
    }

    @Override
    public boolean removeIf(@Nonnull IntPredicate intPredicate) {
        boolean removedAtLeastOne = false;

        for (int i = numElements - 1; i >= 0; --i) {
            if (intPredicate.test(backingArray[i])) {
                removedAtLeastOne = true;
                remove(i);
            }
        }

        return removedAtLeastOne;
    }

    @Override
    public boolean removeIf(@Nonnull Predicate<? super Integer> predicate) {
        return removeIf((IntPredicate) predicate::test);
    }

    public int remove(int index) {
        checkIndex(index);

        int removedElement = backingArray[index];

        --numElements;

        if (index != numElements) {
            System.arraycopy(backingArray, index + 1, backingArray, index, numElements - index);
        }

        return removedElement;
    }

    /**
     * Removes and returns the first element, shifting the rest to the left.
     */
    public int removeFirst() {
        if (numElements == 0) {
            throw new NoSuchElementException();
        }

        return remove(0);
    }

    public int get(int index) {
        checkIndex(index);
        return getUnchecked(index);
    }

    public int getUnchecked(int index) {
        return backingArray[index];
    }

    public void set(int index, int newValue) {
        checkIndex(index);
        backingArray[index] = newValue;
    }

    @Override
    public void clear() {
        numElements = 0;
    }

    public void sort() {
        Arrays.sort(backingArray, 0, numElements);
    }

    public int pop() {
        return remove(numElements - 1);
    }

    public void removeLast() {
        removeLast(1);
    }

    public void removeLast(int n) {
        numElements = Math.max(0, numElements - n);
    }

    public int getLast() {
        int index = numElements - 1;

        if (index >= 0) {
            return backingArray[index];
        }
        else {
            throw new ArrayIndexOutOfBoundsException(index);
        }
    }

    public int getLastOrDefault(int def) {
        int index = numElements - 1;

        if (index >= 0) {
            return backingArray[index];
        }
        else {
            return def;
        }
    }

    @Override
    public String toString() {
        StringBuilder strBuilder = new StringBuilder();

        strBuilder.append("[");

        for (int i = 0; i < numElements; ++i) {
            if (i > 0) {
                strBuilder.append(",");
            }

            strBuilder.append(backingArray[i]);
        }

        strBuilder.append("]");

        return strBuilder.toString();
    }

    protected void checkIndex(int index) {
        if (index < 0 || index >= numElements) {
            throw new ArrayIndexOutOfBoundsException(index);
        }
    }

    private void ensureCanAddNElements(int numNewElements) {
        ensureCapacity((long) numElements + numNewElements);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntArrayList)) return false;

        IntArrayList other = (IntArrayList) o;

        if (numElements != other.numElements) return false;

        for (int i = 0; i < numElements; ++i) {
            if (backingArray[i] != other.backingArray[i]) {
                return false;
            }
        }

        return true;
    }

    @Override
    public int hashCode() {
        int result = numElements;

        for (int i = 0; i < numElements; ++i) {
            result = 31 * result + backingArray[i];
        }

        return result;
    }

    private class IntArrayListCursor implements IntCursor {
        private int index;

        public IntArrayListCursor() {
            this.index = -1;
        }

        @Override
        public void forEachForward(@Nonnull IntConsumer intConsumer) {
            int localNumElements = numElements;

            for (int i = index + 1; i < localNumElements; ++i) {
                intConsumer.accept(backingArray[i]);
            }

            if (localNumElements != numElements) {
                throw new ConcurrentModificationException();
            }

            this.index = numElements;
        }

        @Override
        public int elem() {
            if (index < 0 || index >= numElements) {
                throw new IllegalStateException();
            }

            return backingArray[index];
        }

        @Override
        public boolean moveNext() {
            ++index;

            return index >= 0 && index < numElements;
        }

        @Override
        public void remove() {
            throw new UnsupportedOperationException();
        }
    }

    private class IntArrayListIterator implements IntIterator {
        private int index;

        public IntArrayListIterator() {
            this.index = -1;
        }

        @Override
        public int nextInt() {
            if (index >= numElements - 1) {
                throw new NoSuchElementException();
            }

            return backingArray[++index];
        }

        @Override
        public void forEachRemaining(@Nonnull IntConsumer intConsumer) {
            int localNumElements = numElements;

            for (int i = index + 1; i < localNumElements; ++i) {
                intConsumer.accept(backingArray[i]);
            }

            if (localNumElements != numElements) {
                throw new ConcurrentModificationException();
            }

            index = numElements - 1;
        }

        @Override
        public void forEachRemaining(@Nonnull Consumer<? super Integer> consumer) {
            forEachRemaining((IntConsumer) consumer::accept);
        }

        @Override
        public boolean hasNext() {
            return index < numElements - 1;
        }

        @Override
        public Integer next() {
            return nextInt();
        }

        @Override
        public void remove() {
            throw new UnsupportedOperationException();
        }
    }
}
