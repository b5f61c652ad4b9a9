/*
 * EnvironmentExpander.java
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
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes environment variables into a fully expanded directive tree.
 *
 * <p>Two placeholder forms are recognised:
 * <ul>
 * <li>{@code {env:NAME}} anywhere in a directive name or argument is
 * replaced by the value of the variable, or by the empty string if it is
 * not set.</li>
 * <li>{@code {env_split:NAME}} as an entire argument is replaced by one
 * argument per comma-separated element of the variable's value. If the
 * variable is not set the argument is left as it is.</li>
 * </ul>
 *
 * <p>The split form is tested first, on the argument as written; an
 * argument that is not split then has its {@code {env:NAME}} placeholders
 * substituted in a single left-to-right pass, so substituted values are
 * never themselves expanded.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class EnvironmentExpander {

    private static final Pattern ENV = Pattern.compile("\\{env:([^}]+)\\}");
    private static final Pattern ENV_SPLIT = Pattern.compile("\\{env_split:([^}]+)\\}");

    private final Map<String, String> environment;

    /**
     * Creates an expander over a snapshot of the given environment.
     *
     * @param environment variable names to values
     */
    public EnvironmentExpander(Map<String, String> environment) {
        this.environment = Collections.unmodifiableMap(new HashMap<String, String>(environment));
    }

    /**
     * Expands every node of the list and of their blocks.
     *
     * @param nodes the nodes to expand, may be null
     * @return the expanded nodes, or null if nodes was null
     */
    public List<Node> expand(List<Node> nodes) {
        // null is "no block", an empty list is an empty block
        if (nodes == null) {
            return null;
        }
        List<Node> expanded = new ArrayList<Node>(nodes.size());
        for (Node node : nodes) {
            String name = substitute(node.getName());
            List<String> args = new ArrayList<String>(node.getArgs().size());
            for (String arg : node.getArgs()) {
                List<String> split = split(arg);
                if (split != null) {
                    args.addAll(split);
                } else {
                    args.add(substitute(arg));
                }
            }
            List<Node> children = expand(node.getChildren());
            expanded.add(new Node(name, args, children, node.getFile(), node.getLine()));
        }
        return expanded;
    }

    /**
     * Returns the elements of a {@code {env_split:NAME}} argument, or null
     * if the argument is not of that form or the variable is not set.
     */
    List<String> split(String arg) {
        Matcher matcher = ENV_SPLIT.matcher(arg);
        if (!matcher.matches()) {
            return null;
        }
        String value = environment.get(matcher.group(1));
        if (value == null) {
            return null;
        }
        return Arrays.asList(value.split(",", -1));
    }

    /**
     * Replaces all {@code {env:NAME}} placeholders in the string.
     */
    String substitute(String s) {
        if (s.indexOf("{env:") < 0) {
            return s;
        }
        Matcher matcher = ENV.matcher(s);
        StringBuffer buf = new StringBuffer();
        while (matcher.find()) {
            String value = environment.get(matcher.group(1));
            if (value == null) {
                value = "";
            }
            matcher.appendReplacement(buf, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(buf);
        return buf.toString();
    }

}
