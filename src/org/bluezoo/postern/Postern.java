/*
 * Postern.java
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

package org.bluezoo.postern;

import org.bluezoo.postern.config.ConfigParseException;
import org.bluezoo.postern.config.ConfigParser;
import org.bluezoo.postern.config.Node;
import org.bluezoo.postern.config.NodeWriter;
import org.bluezoo.postern.util.LaconicFormatter;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command-line entry point. Loads the server configuration and refuses
 * to continue if it cannot be read completely.
 * <pre>
 * postern [-config path] [-dump] [-debug] [-v]
 * </pre>
 * <ul>
 * <li>{@code -config} names the configuration file; the default is the
 * {@code postern.config} system property, or
 * {@value #DEFAULT_CONFIG}</li>
 * <li>{@code -dump} writes the fully expanded configuration to standard
 * output</li>
 * <li>{@code -debug} enables debug logging</li>
 * <li>{@code -v} prints the version and exits</li>
 * </ul>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Postern {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.postern.L10N");
    private static final Logger LOGGER = Logger.getLogger(Postern.class.getName());

    /** Default configuration file location. */
    public static final String DEFAULT_CONFIG = "/etc/postern/postern.conf";

    /** Exit status for a successful run. */
    static final int EXIT_OK = 0;

    /** Exit status for usage and configuration errors. */
    static final int EXIT_ERROR = 2;

    private final ConfigParser parser;
    private final PrintStream out;

    private File configFile;
    private boolean dump;

    Postern(ConfigParser parser, PrintStream out) {
        this.parser = parser;
        this.out = out;
        this.configFile = new File(System.getProperty("postern.config", DEFAULT_CONFIG));
    }

    /**
     * Parses the command-line arguments.
     *
     * @return -1 to continue, or the exit status to stop with
     */
    int parseArguments(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("-config".equals(arg) && i + 1 < args.length) {
                configFile = new File(args[++i]);
            } else if ("-dump".equals(arg)) {
                dump = true;
            } else if ("-debug".equals(arg)) {
                setLogLevel(Level.FINE);
            } else if ("-v".equals(arg)) {
                out.println(MessageFormat.format(L10N.getString("version"), getVersion()));
                return EXIT_OK;
            } else {
                out.println(L10N.getString("usage"));
                return EXIT_ERROR;
            }
        }
        return -1;
    }

    /**
     * Loads the configuration.
     *
     * @return the exit status
     */
    int run() {
        List<Node> config;
        try {
            long t1 = System.currentTimeMillis();
            config = parser.parse(configFile);
            long t2 = System.currentTimeMillis();
            if (LOGGER.isLoggable(Level.FINE)) {
                String message = L10N.getString("fine.read_configuration");
                LOGGER.fine(MessageFormat.format(message, String.valueOf(t2 - t1)));
            }
        } catch (ConfigParseException e) {
            // the message already carries file and line
            LOGGER.severe(e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            String message = L10N.getString("err.read_configuration");
            LOGGER.log(Level.SEVERE, MessageFormat.format(message, configFile, e.getMessage()), e);
            return EXIT_ERROR;
        }

        if (dump) {
            try {
                Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
                new NodeWriter(writer).write(config);
            } catch (IOException e) {
                LOGGER.log(Level.SEVERE, L10N.getString("err.dump"), e);
                return EXIT_ERROR;
            }
        } else {
            String message = L10N.getString("info.configuration_ok");
            out.println(MessageFormat.format(message, configFile, String.valueOf(config.size())));
        }
        return EXIT_OK;
    }

    /**
     * Runs the command with the given arguments.
     *
     * @return the exit status
     */
    static int run(String[] args, ConfigParser parser, PrintStream out) {
        Postern postern = new Postern(parser, out);
        int status = postern.parseArguments(args);
        if (status >= 0) {
            return status;
        }
        return postern.run();
    }

    static String getVersion() {
        String version = Postern.class.getPackage().getImplementationVersion();
        return (version != null) ? version : L10N.getString("version.unknown");
    }

    private static void setLogLevel(Level level) {
        Logger root = Logger.getLogger("org.bluezoo.postern");
        root.setLevel(level);
        for (Handler handler : Logger.getLogger("").getHandlers()) {
            handler.setLevel(level);
        }
    }

    private static void configureLogging() {
        Logger root = Logger.getLogger("");
        for (Handler handler : root.getHandlers()) {
            root.removeHandler(handler);
        }
        Handler handler = new ConsoleHandler();
        handler.setFormatter(new LaconicFormatter());
        root.addHandler(handler);
    }

    public static void main(String[] args) {
        configureLogging();
        System.exit(run(args, new ConfigParser(), System.out));
    }

}
