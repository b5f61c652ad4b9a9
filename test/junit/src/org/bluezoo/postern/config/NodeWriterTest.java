/*
 * NodeWriterTest.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of postern, a composable Java mail server.
 *
 * postern is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * postern is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with postern.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.postern.config;

import org.junit.Test;
import static org.junit.Assert.*;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Unit tests for {@link NodeWriter}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class NodeWriterTest {

    private static String write(List<Node> nodes) throws IOException {
        StringWriter out = new StringWriter();
        new NodeWriter(out).write(nodes);
        return out.toString();
    }

    @Test
    public void testWrite() throws IOException {
        Node limit = new Node("limit", Arrays.asList("rate", "20"), null, "f", 3);
        Node limits = new Node("limits", null, Collections.singletonList(limit), "f", 2);
        Node hostname = new Node("hostname", Arrays.asList("mx.example.org"), null, "f", 5);
        Node smtp = new Node("smtp", Arrays.asList("tcp://0.0.0.0:25"),
                Arrays.asList(limits, hostname), "f", 1);
        Node debug = new Node("debug", null, null, "f", 7);

        String expected = "smtp tcp://0.0.0.0:25 {\n"
                + "\tlimits {\n"
                + "\t\tlimit rate 20\n"
                + "\t}\n"
                + "\thostname mx.example.org\n"
                + "}\n"
                + "debug\n";
        assertEquals(expected, write(Arrays.asList(smtp, debug)));
    }

    @Test
    public void testEmptyBlock() throws IOException {
        Node node = new Node("a", Arrays.asList("b"), Collections.<Node>emptyList(), "f", 1);
        assertEquals("a b {\n}\n", write(Collections.singletonList(node)));
    }

    @Test
    public void testNothing() throws IOException {
        assertEquals("", write(Collections.<Node>emptyList()));
    }

    @Test
    public void testQuote() {
        assertEquals("plain", NodeWriter.quote("plain"));
        assertEquals("{env:HOST}", NodeWriter.quote("{env:HOST}"));
        assertEquals("\"\"", NodeWriter.quote(""));
        assertEquals("\"a b\"", NodeWriter.quote("a b"));
        assertEquals("\"a\tb\"", NodeWriter.quote("a\tb"));
        assertEquals("\"a#b\"", NodeWriter.quote("a#b"));
        assertEquals("\"say \\\"hi\\\"\"", NodeWriter.quote("say \"hi\""));
        assertEquals("\"two\nlines\"", NodeWriter.quote("two\nlines"));
    }

}
