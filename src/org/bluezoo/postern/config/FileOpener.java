/*
 * FileOpener.java
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
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Opens the files named by {@code import} directives.
 *
 * <p>Relative import paths have already been resolved against the
 * directory of the importing file when this interface is called.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see ConfigParser#setFileOpener
 */
public interface FileOpener {

    /**
     * Opens the given file for reading. The caller closes the stream.
     *
     * @param path the file to open
     * @return a stream over the file contents
     * @throws java.nio.file.NoSuchFileException if the file does not exist
     * @throws IOException if the file exists but cannot be opened
     */
    InputStream open(Path path) throws IOException;

}
