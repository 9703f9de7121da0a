package io.esuque.utils.collection;

import com.koloboke.collect.IntCollection;
import com.koloboke.collect.IntCursor;
import com.koloboke.collect.IntIterator;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.IntPredicate;
import java.util.function.Predicate;

/**
 * Read-only view over an {@link IntArrayList}. Reads go straight to the
 * underlying list, so the view always reflects its current contents;
 * every mutator throws {@link UnsupportedOperationException}.
 */
public final class IntArrayListView implements IntCollection {
    private final IntArrayList source;

    public IntArrayListView(IntArrayList source) {
        this.source = source;
    }

    public int get(int index) {
        return source.get(index);
    }

    @Override
    public int size() {
        return source.size();
    }

    @Override
    public long sizeAsLong() {
        return source.sizeAsLong();
    }

    @Override
    public boolean isEmpty() {
        return source.isEmpty();
    }

    @Override
    public boolean contains(Object o) {
        return source.contains(o);
    }

    @Override
    public boolean contains(int element) {
        return source.contains(element);
    }

    @Override
    public boolean containsAll(@Nonnull Collection<?> c) {
        return source.containsAll(c);
    }

    @Nonnull
    @Override
    public Object[] toArray() {
        return source.toArray();
    }

    @Nonnull
    @Override
    public <T> T[] toArray(@Nonnull T[] ts) {
        return source.toArray(ts);
    }

    @Nonnull
    @Override
    public int[] toIntArray() {
        return source.toIntArray();
    }

    @Nonnull
    @Override
    public int[] toArray(@Nonnull int[] ints) {
        return source.toArray(ints);
    }

    @Nonnull
    @Override
    public IntCursor cursor() {
        return source.cursor();
    }

    @Nonnull
    @Override
    public IntIterator iterator() {
        return source.iterator();
    }

    @Override
    public void forEach(@Nonnull IntConsumer intConsumer) {
        source.forEach(intConsumer);
    }

    @Override
    public void forEach(@Nonnull Consumer<? super Integer> consumer) {
        source.forEach(consumer);
    }

    @Override
    public boolean forEachWhile(@Nonnull IntPredicate intPredicate) {
        return source.forEachWhile(intPredicate);
    }

    @Override
    public boolean ensureCapacity(long l) {
        throw new UnsupportedOperationException();
    }

    @Override
    public boolean shrink() {
        throw new UnsupportedOperationException();
    }

    @Override
    public boolean add(@Nonnull Integer integer) {
        throw new UnsupportedOperationException();
    }

    @Override
    public boolean add(int newValue) {
        throw new UnsupportedOperationException();
    }

    @Override
    public boolean remove(Object o) {
        throw new UnsupportedOperationException();
    }

    @Override
    public boolean removeInt(int v) {
        throw new UnsupportedOperationException();
    }

    @Override
    public boolean addAll(@Nonnull Collection<? extends Integer> c) {
        throw new UnsupportedOperationException();
    }

    @Override
    public boolean removeAll(@Nonnull Collection<?> c) {
        throw new UnsupportedOperationException();
    }

    @Override
    public boolean retainAll(@Nonnull Collection<?> c) {
        throw new UnsupportedOperationException();
    }

    @Override
    public boolean removeIf(@Nonnull IntPredicate intPredicate) {
        throw new UnsupportedOperationException();
    }

    @Override
    public boolean removeIf(@Nonnull Predicate<? super Integer> predicate) {
        throw new UnsupportedOperationException();
    }

    @Override
    public void clear() {
        throw new UnsupportedOperationException();
    }

    @Override
    public String toString() {
        return "view" + source;
    }
}
