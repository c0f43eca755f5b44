package org.streetnav.app;

import org.junit.jupiter.api.Test;
import org.streetnav.graph.StreetGraph;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @Test
    void testSampleTownShape() {
        StreetGraph graph = Main.buildSampleTown();
        assertEquals(6, graph.nodeCount());
        assertEquals(16, graph.edgeCount());
    }

    @Test
    void testMainOutputsExpectedLines() {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(buffer, true, StandardCharsets.UTF_8));
            Main.main(new String[0]);
        } finally {
            System.setOut(originalOut);
        }

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("Street network: 6 locations, 16 directed streets"));
        assertTrue(output.contains("Shortest path found! Total distance: 5.0 units"));
        assertTrue(output.contains("Go to Hospital via Center Street (3.0 units)"));
        assertTrue(output.contains("Shortest path found! Total distance: 4.5 units"));
        assertTrue(output.contains("Dijkstra: Home -> Store -> Park (distance: 4.5)"));
        assertTrue(output.contains("A*:       Home -> Store -> Park (distance: 4.5)"));
        assertTrue(output.contains("Both algorithms found optimal paths with the same distance."));
        assertTrue(output.contains("Route:" + System.lineSeparator() + "  Start at Home"));
        assertTrue(output.contains("To Library: (distance: 4.5)"));
        assertTrue(output.contains("  Route: Home -> School -> Library"));
        assertTrue(output.contains("Route: Store -> School -> Library (distance: 3.5)"));
        assertTrue(output.contains("  1. Start at Store"));
        assertTrue(output.contains("  2. Go to School via Park Road (1.5 units)"));
        assertTrue(output.contains("  3. Go to Library via Elm Street (2.0 units)"));
        assertTrue(output.contains("  4. Arrive at Library"));
    }
}
