/*
 * package-info.java
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

/**
 * Configuration language of the postern server.
 *
 * <p>{@link org.bluezoo.postern.config.ConfigParser} turns a configuration
 * file into a list of {@link org.bluezoo.postern.config.Node}s, each a
 * directive with arguments and an optional block of child directives.
 * Before the list is returned:
 * <ul>
 * <li>snippet declarations {@code (name) { ... }} are removed and every
 * {@code import name} is replaced by the snippet body or by the contents
 * of the named file</li>
 * <li>macro declarations {@code $(name) = values} are removed and every
 * {@code $(name)} reference is substituted</li>
 * <li>{@code {env:NAME}} and {@code {env_split:NAME}} are replaced from the
 * environment</li>
 * </ul>
 *
 * <h2>Errors</h2>
 *
 * <p>Every problem is reported as a
 * {@link org.bluezoo.postern.config.ConfigParseException} carrying the file
 * and line of the offending directive, and aborts the parse. Referencing an
 * undefined macro or an unset environment variable is not an error: the
 * reference expands to nothing.
 *
 * <h2>Limits</h2>
 *
 * <p>Blocks may be nested at most 255 deep and import expansion stops with
 * an error after 255 levels, which catches snippets and files that import
 * themselves.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.postern.config;
