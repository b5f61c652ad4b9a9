/*
 * ConfigParseException.java
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

/**
 * Exception thrown when a configuration source cannot be turned into a
 * directive tree. The message is prefixed with the location of the
 * offending directive in the form {@code file:line: }.
 *
 * <p>Consumers that interpret the parsed tree can use
 * {@link #ConfigParseException(Node, String)} to report their own errors
 * at the location of a directive.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ConfigParseException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String detail;
    private final String file;
    private final int line;

    /**
     * Creates a new exception with location information.
     *
     * @param message the error message
     * @param file the source location, or null if not available
     * @param line the line number (1-based), or 0 if not available
     */
    public ConfigParseException(String message, String file, int line) {
        this(message, file, line, null);
    }

    /**
     * Creates a new exception with location information and an underlying
     * cause.
     *
     * @param message the error message
     * @param file the source location, or null if not available
     * @param line the line number (1-based), or 0 if not available
     * @param cause the underlying cause
     */
    public ConfigParseException(String message, String file, int line, Throwable cause) {
        super(formatMessage(message, file, line), cause);
        this.detail = message;
        this.file = file;
        this.line = line;
    }

    /**
     * Creates a new exception located at the given directive.
     *
     * @param node the directive the error relates to
     * @param message the error message
     */
    public ConfigParseException(Node node, String message) {
        this(message, node.getFile(), node.getLine(), null);
    }

    /**
     * Creates a new exception located at the given directive.
     *
     * @param node the directive the error relates to
     * @param message the error message
     * @param cause the underlying cause
     */
    public ConfigParseException(Node node, String message, Throwable cause) {
        this(message, node.getFile(), node.getLine(), cause);
    }

    /**
     * Returns the error message without location information.
     */
    public String getDetail() {
        return detail;
    }

    /**
     * Returns the source location, or null if not available.
     */
    public String getFile() {
        return file;
    }

    /**
     * Returns the line number (1-based), or 0 if not available.
     */
    public int getLine() {
        return line;
    }

    private static String formatMessage(String message, String file, int line) {
        if (file == null || file.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder();
        sb.append(file);
        sb.append(':');
        sb.append(line);
        sb.append(": ");
        sb.append(message);
        return sb.toString();
    }

}
