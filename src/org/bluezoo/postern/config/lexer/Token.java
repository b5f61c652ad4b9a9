/*
 * Token.java
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

package org.bluezoo.postern.config.lexer;

/**
 * A single parsable unit of configuration text.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Token {

    private final String file;
    private final int line;
    private final String text;

    /**
     * Creates a new token.
     *
     * @param file the source location the token was read from
     * @param line the line on which the token starts (1-based)
     * @param text the token text, without any enclosing quotes
     */
    public Token(String file, int line, String text) {
        this.file = file;
        this.line = line;
        this.text = text;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public String getText() {
        return text;
    }

    /**
     * Returns the number of line breaks contained in the token text.
     * Only quoted tokens can span several physical lines.
     */
    int getLineBreaks() {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return file + ":" + line + ": " + text;
    }

}
