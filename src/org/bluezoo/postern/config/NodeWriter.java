/*
 * NodeWriter.java
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

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes directive trees back out in configuration syntax.
 *
 * <p>Arguments containing whitespace, quotes or {@code #}, and empty
 * arguments, are written quoted. Reading the output again gives the same
 * names, arguments and blocks as the nodes written. Arguments consisting
 * only of a brace or of a single backslash have a structural meaning to
 * the parser, and a backslash directly before a quote cannot be escaped,
 * so such arguments cannot be written back.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class NodeWriter {

    private static final String EOL = "\n";
    private static final String INDENT = "\t";

    private final Writer out;

    public NodeWriter(Writer out) {
        this.out = out;
    }

    /**
     * Writes the nodes, one directive per line.
     *
     * @param nodes the top-level nodes
     * @throws IOException if the underlying writer fails
     */
    public void write(List<Node> nodes) throws IOException {
        for (Node node : nodes) {
            write(node, 0);
        }
        out.flush();
    }

    private void write(Node node, int depth) throws IOException {
        indent(depth);
        out.write(node.getName());
        for (String arg : node.getArgs()) {
            out.write(' ');
            out.write(quote(arg));
        }
        List<Node> children = node.getChildren();
        if (children != null) {
            out.write(" {");
            out.write(EOL);
            for (Node child : children) {
                write(child, depth + 1);
            }
            indent(depth);
            out.write('}');
        }
        out.write(EOL);
    }

    private void indent(int depth) throws IOException {
        for (int i = 0; i < depth; i++) {
            out.write(INDENT);
        }
    }

    /**
     * Returns the argument as it must be written to be read back unchanged.
     */
    static String quote(String arg) {
        if (!needsQuoting(arg)) {
            return arg;
        }
        StringBuilder buf = new StringBuilder(arg.length() + 2);
        buf.append('"');
        for (int i = 0; i < arg.length(); i++) {
            char c = arg.charAt(i);
            if (c == '"') {
                buf.append('\\');
            }
            buf.append(c);
        }
        buf.append('"');
        return buf.toString();
    }

    private static boolean needsQuoting(String arg) {
        if (arg.isEmpty()) {
            return true;
        }
        for (int i = 0; i < arg.length(); i++) {
            char c = arg.charAt(i);
            if (Character.isWhitespace(c) || c == '"' || c == '#') {
                return true;
            }
        }
        return false;
    }

}
