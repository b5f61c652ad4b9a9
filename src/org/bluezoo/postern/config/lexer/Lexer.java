/*
 * Lexer.java
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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Splits configuration text into tokens.
 *
 * <p>A token is delimited by whitespace, unless the token starts with a
 * quotes character ({@code "}) in which case the token goes until the
 * closing quotes (the enclosing quotes are not included). Inside quoted
 * strings, quotes may be escaped with a preceding {@code \} character. No
 * other characters may be escaped: the backslash is kept in that case.
 * Curly braces are ordinary words and so are emitted as separate tokens
 * whenever they are surrounded by whitespace.
 *
 * <p>The rest of the line is skipped if a {@code #} character is read
 * outside quotes. Line numbers advance on every LF, including those
 * inside quoted strings; CR characters are ignored.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Lexer {

    private static final int BOM = 0xFEFF;

    private final Reader reader;
    private final String file;
    private int line = 1;
    private boolean started;
    private IOException pending;

    /**
     * Creates a lexer reading UTF-8 text from the given stream.
     *
     * @param in the configuration bytes
     * @param file the location label attached to every token
     */
    public Lexer(InputStream in, String file) {
        this(new InputStreamReader(in, StandardCharsets.UTF_8), file);
    }

    /**
     * Creates a lexer reading from the given character stream.
     *
     * @param in the configuration text
     * @param file the location label attached to every token
     */
    public Lexer(Reader in, String file) {
        this.reader = (in instanceof BufferedReader) ? in : new BufferedReader(in);
        this.file = file;
    }

    /**
     * Reads the next token.
     *
     * <p>If the underlying reader fails after part of a token has been read,
     * that partial token is returned and the failure is thrown by the
     * following call.
     *
     * @return the next token, or null at end of input
     * @throws IOException if the underlying reader fails
     */
    public Token next() throws IOException {
        if (pending != null) {
            IOException e = pending;
            pending = null;
            throw e;
        }
        if (!started) {
            started = true;
            skipByteOrderMark();
        }

        StringBuilder val = new StringBuilder();
        boolean comment = false;
        boolean quoted = false;
        boolean escaped = false;
        int tokenLine = line;

        while (true) {
            int ch;
            try {
                ch = reader.read();
            } catch (IOException e) {
                if (val.length() > 0) {
                    pending = e;
                    return new Token(file, tokenLine, val.toString());
                }
                throw e;
            }
            if (ch == -1) {
                if (val.length() > 0) {
                    return new Token(file, tokenLine, val.toString());
                }
                return null;
            }

            if (quoted) {
                if (!escaped) {
                    if (ch == '\\') {
                        escaped = true;
                        continue;
                    } else if (ch == '"') {
                        return new Token(file, tokenLine, val.toString());
                    }
                }
                if (ch == '\n') {
                    line++;
                }
                if (escaped && ch != '"') {
                    val.append('\\');
                }
                val.append((char) ch);
                escaped = false;
                continue;
            }

            if (isSpace(ch)) {
                if (ch == '\r') {
                    continue;
                }
                if (ch == '\n') {
                    line++;
                    comment = false;
                }
                if (val.length() > 0) {
                    return new Token(file, tokenLine, val.toString());
                }
                continue;
            }

            if (ch == '#') {
                comment = true;
            }
            if (comment) {
                continue;
            }

            if (val.length() == 0) {
                tokenLine = line;
                if (ch == '"') {
                    quoted = true;
                    continue;
                }
            }
            val.append((char) ch);
        }
    }

    private void skipByteOrderMark() throws IOException {
        reader.mark(1);
        int first = reader.read();
        if (first != BOM) {
            reader.reset();
        }
    }

    private static boolean isSpace(int ch) {
        return Character.isWhitespace(ch) || ch == '\u00A0' || ch == '\u0085';
    }

}
