/*
 * LaconicFormatter.java
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

package org.bluezoo.postern.util;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * A logging formatter for the command line: one line per record,
 * prefixed with the program name and level. Stack traces of attached
 * exceptions are only printed when the logger of the record has debug
 * logging enabled; otherwise the exception message is appended.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class LaconicFormatter extends Formatter {

    static final String EOL = System.getProperty("line.separator");

    private final String program;

    public LaconicFormatter() {
        this("postern");
    }

    public LaconicFormatter(String program) {
        this.program = program;
    }

    @Override
    public String format(LogRecord record) {
        StringBuilder buf = new StringBuilder();
        buf.append(program);
        buf.append(": ");
        buf.append(record.getLevel().getLocalizedName());
        buf.append(": ");
        String message = formatMessage(record);
        if (message != null) {
            buf.append(message);
        }
        Throwable t = record.getThrown();
        if (t != null && !verbose(record)) {
            String detail = t.getMessage();
            if (detail != null && (message == null || !message.contains(detail))) {
                buf.append(" (").append(detail).append(')');
            }
        }
        buf.append(EOL);
        if (t != null && verbose(record)) {
            StringWriter sink = new StringWriter();
            PrintWriter filter = new PrintWriter(sink);
            t.printStackTrace(filter);
            filter.flush();
            buf.append(sink.toString());
        }
        return buf.toString();
    }

    private static boolean verbose(LogRecord record) {
        String name = record.getLoggerName();
        Logger logger = Logger.getLogger(name != null ? name : "");
        return logger.isLoggable(Level.FINE);
    }

}
