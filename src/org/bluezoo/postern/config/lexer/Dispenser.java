/*
 * Dispenser.java
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

import org.bluezoo.postern.config.ConfigParseException;

import java.io.IOException;
import java.io.InputStream;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ResourceBundle;

/**
 * Cursor over the tokens of a single configuration source.
 *
 * <p>Before the first call to any of the advancing methods the cursor
 * points to a non-existent token preceding the first one. The cursor never
 * moves past the last token: once the input is exhausted the advancing
 * methods return false and {@link #val()} keeps returning the last token,
 * so errors raised at end of input still carry a useful line number.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Dispenser {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.postern.config.L10N");

    private final String filename;
    private final List<Token> tokens;
    private int cursor = -1;

    /**
     * Reads all tokens from the given stream.
     *
     * @param filename the location label of the source
     * @param in the configuration bytes
     * @throws IOException if the stream cannot be read
     */
    public Dispenser(String filename, InputStream in) throws IOException {
        this(filename, allTokens(new Lexer(in, filename)));
    }

    /**
     * Creates a dispenser over an existing token list.
     *
     * @param filename the location label of the source
     * @param tokens the tokens
     */
    public Dispenser(String filename, List<Token> tokens) {
        this.filename = filename;
        this.tokens = Collections.unmodifiableList(new ArrayList<Token>(tokens));
    }

    /**
     * Drains the lexer.
     */
    static List<Token> allTokens(Lexer lexer) throws IOException {
        List<Token> tokens = new ArrayList<Token>();
        for (Token token = lexer.next(); token != null; token = lexer.next()) {
            tokens.add(token);
        }
        return tokens;
    }

    /**
     * Advances the cursor to the next token, regardless of line.
     *
     * @return true if the cursor moved
     */
    public boolean next() {
        if (cursor < tokens.size() - 1) {
            cursor++;
            return true;
        }
        return false;
    }

    /**
     * Advances the cursor to the next token only if it is on the same
     * logical line as the current one. Use this to read the arguments of
     * a directive.
     *
     * @return true if the cursor moved
     */
    public boolean nextArg() {
        if (cursor < 0) {
            cursor++;
            return true;
        }
        if (cursor >= tokens.size() - 1) {
            return false;
        }
        Token current = tokens.get(cursor);
        Token following = tokens.get(cursor + 1);
        if (sameFile(current, following)
                && current.getLine() + current.getLineBreaks() == following.getLine()) {
            cursor++;
            return true;
        }
        return false;
    }

    /**
     * Advances the cursor to the next token only if it starts a new line.
     *
     * @return true if the cursor moved
     */
    public boolean nextLine() {
        if (cursor < 0) {
            cursor++;
            return true;
        }
        if (cursor >= tokens.size() - 1) {
            return false;
        }
        Token current = tokens.get(cursor);
        Token following = tokens.get(cursor + 1);
        if (!sameFile(current, following)
                || current.getLine() + current.getLineBreaks() < following.getLine()) {
            cursor++;
            return true;
        }
        return false;
    }

    private static boolean sameFile(Token a, Token b) {
        return a.getFile() == null ? b.getFile() == null : a.getFile().equals(b.getFile());
    }

    /**
     * Returns the text of the current token, or the empty string if the
     * cursor is not on a token.
     */
    public String val() {
        if (cursor < 0 || cursor >= tokens.size()) {
            return "";
        }
        return tokens.get(cursor).getText();
    }

    /**
     * Returns the line of the current token, or 0 if the cursor is not on a
     * token.
     */
    public int line() {
        if (cursor < 0 || cursor >= tokens.size()) {
            return 0;
        }
        return tokens.get(cursor).getLine();
    }

    /**
     * Returns the location label of the current token.
     */
    public String file() {
        if (cursor < 0 || cursor >= tokens.size()) {
            return filename;
        }
        String tokenFile = tokens.get(cursor).getFile();
        return tokenFile != null ? tokenFile : filename;
    }

    /**
     * Creates a parse error located at the current token.
     *
     * @param message the description of the problem
     * @return the exception, for the caller to throw
     */
    public ConfigParseException err(String message) {
        return new ConfigParseException(message, file(), line());
    }

    /**
     * Creates a parse error reporting an unexpected current token.
     *
     * @param expected what was expected in place of the current token
     * @return the exception, for the caller to throw
     */
    public ConfigParseException syntaxErr(String expected) {
        String message = MessageFormat.format(L10N.getString("err.syntax"), val(), expected);
        return err(message);
    }

}
