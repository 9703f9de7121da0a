package io.esuque.graph;

import com.koloboke.collect.IntCollection;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import static org.testng.Assert.*;

public class BasicMainGraphTest {

    private BasicMainGraph graph;

    @BeforeMethod
    public void setUp() {
        graph = new BasicMainGraph("test", 4);
    }

    @Test
    public void testNewGraphHasNoEdges() {
        assertEquals(graph.getNumberVertices(), 4);
        assertEquals(graph.getNumberEdges(), 0);

        for (int v = 0; v < 4; ++v) {
            assertTrue(graph.neighborsOf(v).isEmpty(), "Vertex " + v + " should have no neighbours");
            assertNull(graph.getLabel(v));
        }
    }

    @Test
    public void testInsertEdgeIsOneBasedAndDirectional() {
        graph.insertEdge(1, 2);

        assertTrue(graph.isNeighborVertex(0, 1));
        assertFalse(graph.isNeighborVertex(1, 0), "Edges must not be mirrored");
        assertEquals(graph.neighborsOf(0).toIntArray(), new int[]{1});
        assertTrue(graph.neighborsOf(1).isEmpty());
        assertEquals(graph.getNumberEdges(), 1);
    }

    @Test
    public void testInsertEdgeIsIdempotent() {
        graph.insertEdge(1, 2);
        graph.insertEdge(1, 2);

        assertEquals(graph.neighborsOf(0).size(), 1);
        assertEquals(graph.getNumberEdges(), 1);
    }

    @Test
    public void testNeighboursKeepInsertionOrder() {
        graph.insertEdge(1, 4);
        graph.insertEdge(1, 2);
        graph.insertEdge(1, 3);

        assertEquals(graph.neighborsOf(0).toIntArray(), new int[]{3, 1, 2});
    }

    @Test
    public void testInvalidEdgesAreIgnored() {
        graph.insertEdge(2, 2);
        graph.insertEdge(0, 1);
        graph.insertEdge(1, 5);
        graph.insertEdge(-3, 1);

        assertEquals(graph.getNumberEdges(), 0);

        for (int v = 0; v < 4; ++v) {
            IntCollection neighbours = graph.neighborsOf(v);
            assertFalse(neighbours.contains(v));
            assertTrue(neighbours.isEmpty());
        }
    }

    @Test
    public void testRemoveEdge() {
        graph.insertEdge(1, 2);
        graph.insertEdge(1, 3);
        graph.insertEdge(1, 4);

        graph.removeEdge(1, 3);

        assertEquals(graph.neighborsOf(0).toIntArray(), new int[]{1, 3});
        assertEquals(graph.getNumberEdges(), 2);
    }

    @Test
    public void testRemoveAbsentEdgeIsNoOp() {
        graph.insertEdge(1, 2);

        graph.removeEdge(2, 1);
        graph.removeEdge(1, 3);
        graph.removeEdge(7, 1);

        assertEquals(graph.neighborsOf(0).toIntArray(), new int[]{1});
        assertEquals(graph.getNumberEdges(), 1);
    }

    @Test
    public void testRemovedEdgeCanBeInsertedAgain() {
        graph.insertEdge(3, 4);
        graph.removeEdge(3, 4);
        graph.insertEdge(3, 4);

        assertTrue(graph.isNeighborVertex(2, 3));
        assertEquals(graph.getNumberEdges(), 1);
    }

    @Test(expectedExceptions = UnsupportedOperationException.class)
    public void testNeighboursAreReadOnly() {
        graph.neighborsOf(0).add(2);
    }

    @Test
    public void testNeighboursViewIsRestartable() {
        graph.insertEdge(2, 1);
        graph.insertEdge(2, 3);

        IntCollection neighbours = graph.neighborsOf(1);

        assertEquals(neighbours.toIntArray(), new int[]{0, 2});
        assertEquals(neighbours.toIntArray(), new int[]{0, 2});
    }

    @Test(expectedExceptions = IndexOutOfBoundsException.class)
    public void testNeighboursOfUnknownVertex() {
        graph.neighborsOf(4);
    }

    @Test
    public void testIsNeighborVertexOutOfRange() {
        assertFalse(graph.isNeighborVertex(-1, 0));
        assertFalse(graph.isNeighborVertex(0, 100));
    }

    @Test
    public void testLabels() {
        graph.setLabel(0, "first vertex");
        graph.setLabel(3, "last\tvertex");

        assertEquals(graph.getLabel(0), "first vertex");
        assertEquals(graph.getLabel(3), "last\tvertex");
        assertEquals(graph.getVertex(3).getVertexId(), 3);
    }

    @Test
    public void testSetSizeResetsGraph() {
        graph.setLabel(0, "a");
        graph.insertEdge(1, 2);

        graph.setSize(2);

        assertEquals(graph.getNumberVertices(), 2);
        assertEquals(graph.getNumberEdges(), 0);
        assertNull(graph.getLabel(0));
        assertTrue(graph.neighborsOf(0).isEmpty());
    }

    @Test
    public void testSetSizeBounds() {
        graph.setSize(0);
        assertEquals(graph.getNumberVertices(), 0);

        graph.setSize(MainGraph.MAX_NUMBER_VERTICES);
        assertEquals(graph.getNumberVertices(), 100);

        graph.insertEdge(100, 1);
        assertTrue(graph.isNeighborVertex(99, 0));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testSetSizeTooLarge() {
        graph.setSize(101);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testSetSizeNegative() {
        graph.setSize(-1);
    }

    @Test
    public void testCopyIsDeep() {
        graph.setLabel(0, "a");
        graph.insertEdge(1, 2);
        graph.insertEdge(1, 3);

        BasicMainGraph copy = new BasicMainGraph(graph);

        copy.insertEdge(1, 4);
        copy.removeEdge(1, 2);
        copy.setLabel(0, "changed");

        assertEquals(graph.neighborsOf(0).toIntArray(), new int[]{1, 2});
        assertEquals(graph.getNumberEdges(), 2);
        assertEquals(graph.getLabel(0), "a");

        assertEquals(copy.neighborsOf(0).toIntArray(), new int[]{2, 3});
        assertEquals(copy.getNumberEdges(), 2);
        assertEquals(copy.getLabel(0), "changed");
    }
}
