/*
 * ParseContext.java
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

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * State of a single tree read: the token cursor, the current block nesting
 * level and the snippets and macros declared so far.
 *
 * <p>A context reads exactly one source. Imported files are read by a
 * fresh context whose declarations are merged back into the importing
 * context once the import has been resolved, the later declaration
 * replacing an earlier one of the same name.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
class ParseContext {

    private static final Logger LOGGER = Logger.getLogger(ParseContext.class.getName());

    /** Maximum number of nested blocks. */
    static final int MAX_NESTING = 255;

    /** Maximum depth of import expansion. */
    static final int MAX_IMPORT_DEPTH = 255;

    static final String IMPORT = "import";

    private static final Pattern MACRO_REFERENCE = Pattern.compile("\\$\\(([^$]+)\\)");

    /**
     * What a directive read from the source turned out to be.
     */
    enum Kind {
        DIRECTIVE,
        SNIPPET,
        MACRO
    }

    /**
     * A directive while it is being read. Snippet and macro declarations
     * never leave the context in this form: they are recorded in the
     * declaration tables and only plain directives become {@link Node}s.
     */
    static final class RawNode {

        Kind kind = Kind.DIRECTIVE;
        String name;
        final List<String> args = new ArrayList<String>();
        List<Node> children;
        final String file;
        final int line;

        RawNode(String file, int line) {
            this.file = file;
            this.line = line;
        }

        Node toNode() {
            return new Node(name, args, children, file, line);
        }

        ConfigParseException err(String message) {
            return new ConfigParseException(message, file, line);
        }

    }

    private final Dispenser dispenser;
    private final String fileLocation;
    private final FileOpener fileOpener;
    private final Map<String, List<Node>> snippets = new HashMap<String, List<Node>>();
    private final Map<String, List<String>> macros = new HashMap<String, List<String>>();

    // Before reading starts the cursor points to the non-existent token
    // before the first one, which readNodes treats as the opening brace of
    // the top-level block. Starting at -1 makes that block level 0.
    private int nesting = -1;

    ParseContext(Dispenser dispenser, String fileLocation, FileOpener fileOpener) {
        this.dispenser = dispenser;
        this.fileLocation = fileLocation;
        this.fileOpener = fileOpener;
    }

    Map<String, List<Node>> getSnippets() {
        return snippets;
    }

    Map<String, List<String>> getMacros() {
        return macros;
    }

    /**
     * Reads the whole source and expands its imports.
     *
     * @param expansionDepth the import depth at which this source is read
     * @return the top-level directives
     */
    List<Node> readTree(int expansionDepth) throws ConfigParseException {
        List<Node> nodes = readNodes();
        // nesting below zero is already reported by readNodes
        if (nesting > 0) {
            throw dispenser.err(ConfigParser.L10N.getString("err.unexpected_eof"));
        }
        return expandImports(nodes, expansionDepth);
    }

    /**
     * Reads the node whose name is the current token.
     *
     * <p>When this returns, the cursor points to the last token of the node,
     * so callers advance the cursor themselves before reading another node.
     * Reads the node's block through {@link #readNodes} if it has one.
     */
    RawNode readNode() throws ConfigParseException {
        RawNode node = new RawNode(dispenser.file(), dispenser.line());

        if ("{".equals(dispenser.val())) {
            throw dispenser.syntaxErr(ConfigParser.L10N.getString("expect.block_header"));
        }

        node.name = dispenser.val();
        if (node.name.startsWith("(") && node.name.endsWith(")") && node.name.length() >= 2) {
            node.name = node.name.substring(1, node.name.length() - 1);
            node.kind = Kind.SNIPPET;
        }

        boolean continueOnLF = false;
        while (true) {
            while (dispenser.nextArg() || (continueOnLF && dispenser.nextLine())) {
                continueOnLF = false;
                // name arg0 arg1 {
                //                ^ opens the block
                if ("{".equals(dispenser.val())) {
                    node.children = readNodes();
                    break;
                }
                node.args.add(dispenser.val());
            }

            // name arg0 arg1 \
            //     arg2 arg3
            int last = node.args.size() - 1;
            if (last >= 0 && "\\".equals(node.args.get(last))) {
                node.args.remove(last);
                continueOnLF = true;
                continue;
            }
            break;
        }

        parseAsMacro(node);

        if (node.kind == Kind.DIRECTIVE) {
            validateNodeName(node);
        }
        return node;
    }

    private void parseAsMacro(RawNode node) throws ConfigParseException {
        if (!node.name.startsWith("$(")) {
            return;
        }
        if (!node.name.endsWith(")")) {
            throw node.err(ConfigParser.L10N.getString("err.macro_name_end"));
        }
        if (node.args.size() < 2) {
            throw node.err(ConfigParser.L10N.getString("err.macro_args"));
        }
        if (!"=".equals(node.args.get(0))) {
            throw node.err(ConfigParser.L10N.getString("err.macro_missing_eq"));
        }
        node.name = node.name.substring(2, node.name.length() - 1);
        node.args.remove(0);
        node.kind = Kind.MACRO;
    }

    static void validateNodeName(RawNode node) throws ConfigParseException {
        String name = node.name;
        if (name.isEmpty()) {
            throw node.err(ConfigParser.L10N.getString("err.empty_name"));
        }
        if (Character.isDigit(name.codePointAt(0))) {
            throw node.err(ConfigParser.L10N.getString("err.name_digit"));
        }
        for (int i = 0; i < name.length(); ) {
            int ch = name.codePointAt(i);
            if (!Character.isLetter(ch) && !Character.isDigit(ch)
                    && ch != '.' && ch != '-' && ch != '_') {
                String message = ConfigParser.L10N.getString("err.name_char");
                throw node.err(MessageFormat.format(message, new String(Character.toChars(ch))));
            }
            i += Character.charCount(ch);
        }
    }

    /**
     * Reads the nodes of the current block.
     *
     * <p>The cursor should point to the opening brace when this is called
     * and points to the closing brace when it returns.
     * <pre>
     * name arg0 arg1 {  # here on entry
     *     c0
     *     c1
     * }                 # here on return
     * </pre>
     *
     * <p>Each iteration reads one logical line. A closing brace on the same
     * physical line as the last child ({@code a { b c }}) is read as the
     * last argument of that child and closes the block.
     */
    List<Node> readNodes() throws ConfigParseException {
        // not null even when empty: an empty block is still a block
        List<Node> res = new ArrayList<Node>();

        if (nesting >= MAX_NESTING) {
            throw dispenser.err(ConfigParser.L10N.getString("err.nesting_limit"));
        }
        nesting++;

        boolean requireNewLine = false;
        while (true) {
            if (requireNewLine) {
                if (!dispenser.nextLine()) {
                    if (!dispenser.next()) {
                        return res;
                    }
                    throw dispenser.err(ConfigParser.L10N.getString("err.newline_after_brace"));
                }
            } else if (!dispenser.next()) {
                break;
            }

            // } on a line of its own ends the block
            if ("}".equals(dispenser.val())) {
                nesting--;
                // a { }   }
                //     ^   ^ the second brace takes the level below zero
                if (nesting < 0) {
                    throw dispenser.err(ConfigParser.L10N.getString("err.unexpected_close"));
                }
                break;
            }

            RawNode node = readNode();
            requireNewLine = true;

            boolean shouldStop = false;
            // name arg0 arg1 {
            //     c0 c0arg0 }
            //               ^
            int last = node.args.size() - 1;
            if (last >= 0 && "}".equals(node.args.get(last))) {
                nesting--;
                if (nesting < 0) {
                    throw dispenser.err(ConfigParser.L10N.getString("err.unexpected_close"));
                }
                node.args.remove(last);
                shouldStop = true;
            }

            if (node.kind == Kind.MACRO) {
                if (nesting != 0) {
                    throw node.err(ConfigParser.L10N.getString("err.macro_top_level"));
                }
                // a declaration can refer to macros declared before it
                List<String> values = expandArgs(node.args, node.file, node.line);
                declareMacro(node, values);
                continue;
            }
            if (node.kind == Kind.SNIPPET) {
                if (nesting != 0) {
                    throw node.err(ConfigParser.L10N.getString("err.snippet_top_level"));
                }
                if (!node.args.isEmpty()) {
                    throw node.err(ConfigParser.L10N.getString("err.snippet_args"));
                }
                declareSnippet(node);
                continue;
            }

            res.add(expandMacros(node.toNode()));
            if (shouldStop) {
                break;
            }
        }
        return res;
    }

    private void declareMacro(RawNode node, List<String> values) {
        if (LOGGER.isLoggable(Level.FINEST)) {
            String message = ConfigParser.L10N.getString("finest.macro");
            LOGGER.finest(MessageFormat.format(message, node.name, node.file,
                    String.valueOf(node.line)));
        }
        macros.put(node.name, Collections.unmodifiableList(values));
    }

    private void declareSnippet(RawNode node) {
        if (LOGGER.isLoggable(Level.FINEST)) {
            String message = ConfigParser.L10N.getString("finest.snippet");
            LOGGER.finest(MessageFormat.format(message, node.name, node.file,
                    String.valueOf(node.line)));
        }
        List<Node> subtree = node.children;
        if (subtree == null) {
            subtree = Collections.emptyList();
        }
        snippets.put(node.name, subtree);
    }

    /**
     * Substitutes macro references in the arguments of the node and of
     * all its descendants.
     */
    Node expandMacros(Node node) throws ConfigParseException {
        String name = node.getName();
        List<String> args = expandArgs(node.getArgs(), node.getFile(), node.getLine());
        List<Node> children = node.getChildren();
        if (children != null) {
            List<Node> expanded = new ArrayList<Node>(children.size());
            for (Node child : children) {
                expanded.add(expandMacros(child));
            }
            children = expanded;
        }
        return new Node(name, args, children, node.getFile(), node.getLine());
    }

    /**
     * An argument that is exactly {@code $(name)} is replaced by all values
     * of the macro, or removed if the macro is undefined. A reference
     * embedded in a longer argument is replaced by the single value of the
     * macro.
     */
    List<String> expandArgs(List<String> args, String file, int line)
            throws ConfigParseException {
        List<String> newArgs = new ArrayList<String>(args.size());
        for (String arg : args) {
            if (!arg.startsWith("$(") || !arg.endsWith(")")) {
                if (arg.contains("$(") && arg.contains(")")) {
                    arg = expandSingleValueMacros(arg, file, line);
                }
                newArgs.add(arg);
                continue;
            }

            String macroName = arg.substring(2, arg.length() - 1);
            List<String> replacement = macros.get(macroName);
            if (replacement != null) {
                newArgs.addAll(replacement);
            }
        }
        return newArgs;
    }

    private String expandSingleValueMacros(String arg, String file, int line)
            throws ConfigParseException {
        List<String> names = new ArrayList<String>();
        Matcher matcher = MACRO_REFERENCE.matcher(arg);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        for (String macroName : names) {
            List<String> values = macros.get(macroName);
            if (values != null && values.size() > 1) {
                String message = ConfigParser.L10N.getString("err.macro_multi_value");
                throw new ConfigParseException(MessageFormat.format(message, macroName), file, line);
            }
            String value = (values == null || values.isEmpty()) ? "" : values.get(0);
            arg = arg.replace("$(" + macroName + ")", value);
        }
        return arg;
    }

    /**
     * Replaces every {@code import} directive in the list, and in the
     * blocks of the listed nodes, with the snippet or file it names.
     * Imported content may itself contain imports, so the list is expanded
     * again until none are left.
     *
     * @param children the nodes to expand, may be null for no block
     * @param expansionDepth the current import depth
     * @return the expanded nodes, or null if children was null
     */
    List<Node> expandImports(List<Node> children, int expansionDepth)
            throws ConfigParseException {
        // null means "no block", keep it that way
        if (children == null) {
            return null;
        }

        List<Node> expanded = new ArrayList<Node>(children.size());
        boolean containsImports = false;
        for (Node child : children) {
            if (child.hasBlock()) {
                child = child.withChildren(expandImports(child.getChildren(), expansionDepth + 1));
            }

            if (IMPORT.equals(child.getName())) {
                // checked here rather than on entry so the error points at
                // the directive that caused it
                if (expansionDepth > MAX_IMPORT_DEPTH) {
                    throw new ConfigParseException(child,
                            ConfigParser.L10N.getString("err.import_limit"));
                }
                containsImports = true;
                if (child.getArgs().size() != 1) {
                    throw new ConfigParseException(child,
                            ConfigParser.L10N.getString("err.import_args"));
                }
                expanded.addAll(resolveImport(child, child.getArgs().get(0), expansionDepth));
            } else {
                expanded.add(child);
            }
        }

        if (containsImports) {
            return expandImports(expanded, expansionDepth + 1);
        }
        return expanded;
    }

    /**
     * Returns the nodes named by an import directive: a snippet if one of
     * that name is declared, otherwise the contents of a file.
     */
    List<Node> resolveImport(Node node, String name, int expansionDepth)
            throws ConfigParseException {
        List<Node> subtree = snippets.get(name);
        if (subtree != null) {
            return subtree;
        }

        Path file;
        try {
            file = resolvePath(name);
        } catch (InvalidPathException e) {
            String message = ConfigParser.L10N.getString("err.unknown_import");
            throw new ConfigParseException(node, MessageFormat.format(message, name), e);
        }

        InputStream in = open(node, name, file);
        if (in == null) {
            file = Paths.get(file.toString() + ".conf");
            in = open(node, name, file);
        }
        if (in == null) {
            String message = ConfigParser.L10N.getString("err.unknown_import");
            throw new ConfigParseException(node, MessageFormat.format(message, name));
        }

        String location = file.toString();
        if (LOGGER.isLoggable(Level.FINER)) {
            String message = ConfigParser.L10N.getString("finer.import_file");
            LOGGER.finer(MessageFormat.format(message, location, node.getFile(),
                    String.valueOf(node.getLine())));
        }

        ParseContext imported;
        try {
            try {
                imported = new ParseContext(new Dispenser(location, in), location, fileOpener);
            } finally {
                in.close();
            }
        } catch (IOException e) {
            String message = ConfigParser.L10N.getString("err.import_io");
            throw new ConfigParseException(node, MessageFormat.format(message, name, e.getMessage()), e);
        }

        List<Node> nodes = imported.readTree(expansionDepth + 1);
        merge(imported);
        return nodes;
    }

    private Path resolvePath(String name) {
        Path path = Paths.get(name);
        if (path.isAbsolute()) {
            return path;
        }
        // a source without a location has no directory to resolve against
        Path dir = (fileLocation == null) ? null : Paths.get(fileLocation).getParent();
        return (dir == null) ? path : dir.resolve(path);
    }

    /**
     * Opens the file, returning null if it does not exist.
     */
    private InputStream open(Node node, String name, Path file) throws ConfigParseException {
        try {
            return fileOpener.open(file);
        } catch (NoSuchFileException | FileNotFoundException e) {
            return null;
        } catch (IOException e) {
            String message = ConfigParser.L10N.getString("err.import_io");
            throw new ConfigParseException(node, MessageFormat.format(message, name, e.getMessage()), e);
        }
    }

    private void merge(ParseContext imported) {
        for (Map.Entry<String, List<Node>> entry : imported.snippets.entrySet()) {
            List<Node> previous = snippets.put(entry.getKey(), entry.getValue());
            if (previous != null) {
                logRedefinition(entry.getKey(), imported.fileLocation);
            }
        }
        for (Map.Entry<String, List<String>> entry : imported.macros.entrySet()) {
            List<String> previous = macros.put(entry.getKey(), entry.getValue());
            if (previous != null) {
                logRedefinition("$(" + entry.getKey() + ")", imported.fileLocation);
            }
        }
    }

    private void logRedefinition(String name, String location) {
        if (LOGGER.isLoggable(Level.FINEST)) {
            String message = ConfigParser.L10N.getString("finest.redefined");
            LOGGER.finest(MessageFormat.format(message, name, location));
        }
    }

}
