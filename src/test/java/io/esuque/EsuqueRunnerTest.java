package io.esuque;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.file.Paths;

import static org.testng.Assert.*;

public class EsuqueRunnerTest {
    private static final String NL = System.lineSeparator();

    private ByteArrayOutputStream bytes;
    private EsuqueRunner runner;
    private String cyclePath;

    @BeforeMethod
    public void setUp() throws Exception {
        bytes = new ByteArrayOutputStream();
        runner = new EsuqueRunner(new PrintStream(bytes, true, "UTF-8"));
        cyclePath = Paths.get(EsuqueRunnerTest.class.getResource("/graphs/cycle5.graph").toURI()).toString();
    }

    private String output() throws UnsupportedEncodingException {
        return bytes.toString("UTF-8");
    }

    @Test
    public void testPrintsSubgraphs() throws UnsupportedEncodingException {
        int status = runner.run(new String[]{"-g", cyclePath, "-k", "3"});

        assertEquals(status, 0);
        assertEquals(output(), "1 2 5 " + NL + "1 2 3 " + NL + "1 5 4 " + NL + "2 3 4 " + NL + "3 4 5 " + NL);
    }

    @Test
    public void testDisplayGraphFirst() throws UnsupportedEncodingException {
        int status = runner.run(new String[]{"--graph", cyclePath, "--size", "5", "--display"});

        assertEquals(status, 0);

        String output = output();

        assertTrue(output.startsWith("Description\t\t\t\t\tFrom\tTo" + NL + "Vertex one" + NL), output);
        assertTrue(output.endsWith(NL + "1 2 5 3 4 " + NL), output);
    }

    @Test
    public void testCountOnly() throws UnsupportedEncodingException {
        int status = runner.run(new String[]{"-g", cyclePath, "-k", "2", "-y", "esuque-count.yaml"});

        assertEquals(status, 0);
        assertEquals(output(), "");
    }

    @Test
    public void testInvalidSize() {
        assertEquals(runner.run(new String[]{"-g", cyclePath, "-k", "6"}), 1);
        assertEquals(runner.run(new String[]{"-g", cyclePath, "-k", "0"}), 1);
        assertEquals(runner.run(new String[]{"-g", cyclePath, "-k", "many"}), 1);
    }

    @Test
    public void testMissingGraph() {
        assertEquals(runner.run(new String[0]), 1);
        assertEquals(runner.run(new String[]{"-g", cyclePath + ".missing"}), 1);
    }

    @Test
    public void testUnknownOption() {
        assertEquals(runner.run(new String[]{"--bogus"}), 1);
    }

    @Test
    public void testHelp() throws UnsupportedEncodingException {
        assertEquals(runner.run(new String[]{"-h"}), 0);
        assertTrue(output().contains("esuque"), output());
    }
}
