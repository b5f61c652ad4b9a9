/*
 * Node.java
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A parsed configuration block or simple directive.
 * <pre>
 * name arg0 arg1 {
 *     child0
 *     child1
 * }
 * </pre>
 *
 * <p>Nodes are immutable. A node written without braces has no children
 * list at all ({@link #getChildren()} returns null), which is distinct
 * from a node written with an empty block {@code { }} (an empty list).
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Node {

    private final String name;
    private final List<String> args;
    private final List<Node> children;
    private final String file;
    private final int line;

    /**
     * Creates a new node.
     *
     * @param name the directive name
     * @param args the arguments following the name, may be null for none
     * @param children the block contents, or null if the directive has no block
     * @param file the source location
     * @param line the line of the directive (for blocks, the header line)
     */
    public Node(String name, List<String> args, List<Node> children, String file, int line) {
        this.name = name;
        this.args = (args == null) ? Collections.<String>emptyList()
                : Collections.unmodifiableList(new ArrayList<String>(args));
        this.children = (children == null) ? null
                : Collections.unmodifiableList(new ArrayList<Node>(children));
        this.file = file;
        this.line = line;
    }

    /**
     * Returns the directive name, the first word of the node's line.
     */
    public String getName() {
        return name;
    }

    /**
     * Returns the arguments placed after the directive name. Never null.
     */
    public List<String> getArgs() {
        return args;
    }

    /**
     * Returns the nodes inside this node's block, or null if the directive
     * has no block.
     */
    public List<Node> getChildren() {
        return children;
    }

    /**
     * Indicates whether the directive was written with a block.
     */
    public boolean hasBlock() {
        return children != null;
    }

    /**
     * Returns the name of the source the directive was read from.
     */
    public String getFile() {
        return file;
    }

    /**
     * Returns the line number where the directive is located in its source.
     * For blocks this is the line where the block header resides.
     */
    public int getLine() {
        return line;
    }

    Node withChildren(List<Node> newChildren) {
        return new Node(name, args, newChildren, file, line);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Node)) {
            return false;
        }
        Node o = (Node) other;
        return line == o.line
                && Objects.equals(name, o.name)
                && args.equals(o.args)
                && Objects.equals(children, o.children)
                && Objects.equals(file, o.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, args, children, file, line);
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        buf.append(file).append(':').append(line).append(' ').append(name);
        for (String arg : args) {
            buf.append(' ').append(arg);
        }
        if (children != null) {
            buf.append(" {");
            for (Node child : children) {
                buf.append(' ').append(child.getName());
            }
            buf.append(" }");
        }
        return buf.toString();
    }

}
