/*
 * ConfigParser.java
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

import org.bluezoo.postern.config.lexer.Dispenser;

import java.io.BufferedInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.text.MessageFormat;
import java.util.List;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Parser for the postern configuration file.
 *
 * <p>Configuration format features:
 * <ul>
 * <li>Directives with arguments and optional nested blocks</li>
 * <li>Quoted arguments and {@code #} comments</li>
 * <li>Line continuation with a trailing {@code \}</li>
 * <li>Snippets declared with {@code (name) { ... }} and inserted with
 * {@code import name}</li>
 * <li>Imports of other files, relative to the importing file, with an
 * optional {@code .conf} suffix</li>
 * <li>Macros declared with {@code $(name) = values...} and referenced as
 * {@code $(name)}</li>
 * <li>Environment variables referenced as {@code {env:NAME}} and
 * {@code {env_split:NAME}}</li>
 * </ul>
 * <pre>
 * $(hostname) = mx.example.org
 * (tls) {
 *     cert /etc/postern/certs/$(hostname).crt
 * }
 * smtp tcp://0.0.0.0:25 {
 *     hostname $(hostname)
 *     import tls
 *     limits {env_split:SMTP_LIMITS}
 * }
 * import local/aliases
 * </pre>
 *
 * <p>Any error aborts the parse: no partial result is returned. A parser
 * may be reused, but each parse is independent of the others and a
 * single instance should not be used from several threads at once.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ConfigParser {

    private static final Logger LOGGER = Logger.getLogger(ConfigParser.class.getName());

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.postern.config.L10N");

    private Map<String, String> environment;
    private FileOpener fileOpener = new LocalFileOpener();

    /**
     * Sets the environment used to expand {@code {env:...}} placeholders.
     * If not set, the process environment at the time of each parse is used.
     *
     * @param environment variable names to values
     */
    public void setEnvironment(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Sets the means by which imported files are opened.
     *
     * @param fileOpener the file opener
     */
    public void setFileOpener(FileOpener fileOpener) {
        if (fileOpener == null) {
            throw new IllegalArgumentException("File opener cannot be null");
        }
        this.fileOpener = fileOpener;
    }

    /**
     * Parses a configuration file.
     *
     * @param file the configuration file
     * @return the fully expanded top-level directives
     * @throws IOException if the file cannot be read
     * @throws ConfigParseException if the configuration is invalid
     */
    public List<Node> parse(File file) throws IOException, ConfigParseException {
        try (InputStream in = new BufferedInputStream(new FileInputStream(file))) {
            return parse(in, file.getPath());
        }
    }

    /**
     * Parses configuration text. Relative imports are resolved against the
     * directory part of the location, or against the working directory if
     * the location is null or has no directory part.
     *
     * @param in the configuration bytes, in UTF-8
     * @param location the name of the source, used in error messages, or null
     * @return the fully expanded top-level directives
     * @throws IOException if the stream cannot be read
     * @throws ConfigParseException if the configuration is invalid
     */
    public List<Node> parse(InputStream in, String location)
            throws IOException, ConfigParseException {
        long t1 = System.currentTimeMillis();

        ParseContext ctx = new ParseContext(new Dispenser(location, in), location, fileOpener);
        List<Node> nodes = ctx.readTree(0);

        Map<String, String> env = (environment != null) ? environment : System.getenv();
        nodes = new EnvironmentExpander(env).expand(nodes);

        if (LOGGER.isLoggable(Level.FINE)) {
            long t2 = System.currentTimeMillis();
            String message = L10N.getString("fine.parsed");
            LOGGER.fine(MessageFormat.format(message, location,
                    String.valueOf(nodes.size()), String.valueOf(t2 - t1)));
        }
        return nodes;
    }

}
