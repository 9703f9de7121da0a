package io.esuque.utils.collection;

import com.koloboke.collect.IntCursor;
import com.koloboke.collect.IntIterator;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Consumer;

import static org.testng.Assert.*;

public class IntArrayListTest {

    @Test
    public void testAddGrowsPastInitialCapacity() {
        IntArrayList list = new IntArrayList(2);

        for (int i = 0; i < 100; ++i) {
            list.add(i);
        }

        assertEquals(list.size(), 100);
        assertEquals(list.get(0), 0);
        assertEquals(list.get(99), 99);
        assertEquals(list.getLast(), 99);
    }

    @Test
    public void testAddIfAbsent() {
        IntArrayList list = IntArrayList.of(3, 1);

        assertTrue(list.addIfAbsent(2));
        assertFalse(list.addIfAbsent(3));
        assertEquals(list, IntArrayList.of(3, 1, 2));
    }

    @Test
    public void testRemoveFirstKeepsOrder() {
        IntArrayList list = IntArrayList.of(5, 6, 7);

        assertEquals(list.removeFirst(), 5);
        assertEquals(list.toString(), "[6,7]");
        assertEquals(list.removeFirst(), 6);
        assertEquals(list.removeFirst(), 7);
        assertTrue(list.isEmpty());
    }

    @Test(expectedExceptions = NoSuchElementException.class)
    public void testRemoveFirstOnEmpty() {
        new IntArrayList().removeFirst();
    }

    @Test
    public void testRemoveByValueAndIndex() {
        IntArrayList list = IntArrayList.of(4, 8, 15, 16, 23);

        assertTrue(list.removeInt(15));
        assertFalse(list.removeInt(42));
        assertEquals(list.remove(0), 4);
        assertEquals(list, IntArrayList.of(8, 16, 23));
        assertEquals(list.indexOf(23), 2);
        assertEquals(list.indexOf(4), -1);
    }

    @Test(expectedExceptions = ArrayIndexOutOfBoundsException.class)
    public void testGetOutOfRange() {
        IntArrayList.of(1, 2).get(2);
    }

    @Test
    public void testCopyIsIndependent() {
        IntArrayList original = IntArrayList.of(1, 2, 3);
        IntArrayList copy = new IntArrayList(original);

        copy.add(4);
        copy.set(0, 9);

        assertEquals(original, IntArrayList.of(1, 2, 3));
        assertEquals(copy, IntArrayList.of(9, 2, 3, 4));
    }

    @Test
    public void testCursorVisitsInOrder() {
        IntArrayList list = IntArrayList.of(9, 2, 7);
        IntArrayList visited = new IntArrayList();

        IntCursor cursor = list.cursor();

        while (cursor.moveNext()) {
            visited.add(cursor.elem());
        }

        assertEquals(visited, list);
    }

    @Test
    public void testIteratorForEachRemainingBoxed() {
        IntArrayList list = IntArrayList.of(4, 5, 6);
        IntIterator iterator = list.iterator();

        assertEquals(iterator.nextInt(), 4);

        List<Integer> rest = new ArrayList<>();
        Consumer<Integer> collector = rest::add;
        iterator.forEachRemaining(collector);

        assertEquals(rest, Arrays.asList(5, 6));
        assertFalse(iterator.hasNext());
    }

    @Test
    public void testRemoveLastAndPop() {
        IntArrayList list = IntArrayList.of(1, 2, 3, 4);

        assertEquals(list.pop(), 4);
        list.removeLast();
        assertEquals(list, IntArrayList.of(1, 2));
        list.removeLast(5);
        assertTrue(list.isEmpty());
        assertEquals(list.getLastOrDefault(-1), -1);
    }

    @Test
    public void testViewReflectsSourceAndIsReadOnly() {
        IntArrayList list = IntArrayList.of(1, 2);
        IntArrayListView view = new IntArrayListView(list);

        list.add(3);

        assertEquals(view.size(), 3);
        assertEquals(view.get(2), 3);
        assertTrue(view.contains(2));
        assertEquals(view.toIntArray(), new int[]{1, 2, 3});

        try {
            view.add(4);
            fail("View must not accept additions");
        } catch (UnsupportedOperationException e) {
            // expected
        }

        assertEquals(list.size(), 3);
    }
}
