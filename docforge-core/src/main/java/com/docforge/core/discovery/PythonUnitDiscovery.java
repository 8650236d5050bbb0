package com.docforge.core.discovery;

import com.docforge.core.model.DocumentableUnit;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Discovers public Python functions and methods using line-based pattern matching.
 *
 * <p><b>Features:</b>
 * <ul>
 *   <li>Module-level functions and methods of module-level classes (sync and async)</li>
 *   <li>Definitions whose parameter list spans several lines</li>
 *   <li>Docstrings in single or triple quotes, dedented</li>
 *   <li>Return annotations ({@code -> str})</li>
 *   <li>Dependencies from {@code import x.y} and {@code from .x import y} statements</li>
 * </ul>
 *
 * <p>Names starting with an underscore are private and skipped, as are nested functions.
 * {@code self} and {@code cls} are omitted from method signatures.
 */
public class PythonUnitDiscovery extends AbstractUnitDiscovery {

    private static final Pattern CLASS_PATTERN = Pattern.compile(
        "^class\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*[(:]"
    );

    private static final Pattern FUNCTION_DEF_PATTERN = Pattern.compile(
        "^(?:async\\s+)?def\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*\\((.*)\\)\\s*(?:->\\s*(.+?))?\\s*:",
        Pattern.DOTALL
    );

    private static final Pattern IMPORT_PATTERN = Pattern.compile(
        "^import\\s+(.+)$"
    );

    private static final Pattern FROM_IMPORT_PATTERN = Pattern.compile(
        "^from\\s+(\\.*)([A-Za-z0-9_.]*)\\s+import\\s+(.+)$"
    );

    private static final Set<String> IMPLICIT_RECEIVERS = Set.of("self", "cls");

    @Override
    public String getId() {
        return "python";
    }

    @Override
    protected String extension() {
        return "py";
    }

    @Override
    protected List<DocumentableUnit> parseFile(Path file, Path base) throws IOException {
        List<String> lines = Files.readAllLines(file);
        String module = moduleName(file, base);
        List<DocumentableUnit> units = new ArrayList<>();
        Deque<Scope> scopes = new ArrayDeque<>();

        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith("@")) {
                i++;
                continue;
            }

            int indent = indentOf(line);
            while (!scopes.isEmpty() && scopes.peek().indent() >= indent) {
                scopes.pop();
            }

            Matcher classMatcher = CLASS_PATTERN.matcher(trimmed);
            if (classMatcher.find()) {
                scopes.push(new Scope(indent, classMatcher.group(1), true));
                i++;
                continue;
            }

            if (trimmed.startsWith("def ") || trimmed.startsWith("async def ")) {
                int end = definitionEnd(lines, i);
                String definition = joinLines(lines, i, end);
                Matcher functionMatcher = FUNCTION_DEF_PATTERN.matcher(definition);
                if (functionMatcher.find()) {
                    String name = functionMatcher.group(1);
                    boolean inClass = !scopes.isEmpty() && scopes.peek().isClass() && scopes.size() == 1;
                    Docstring docstring = readDocstring(lines, end + 1);
                    if (isPublic(name, scopes)) {
                        List<String> parameters = parseParameters(functionMatcher.group(2), inClass);
                        String owner = inClass ? module + "." + scopes.peek().name() : module;
                        units.add(new DocumentableUnit(
                            name,
                            owner,
                            docstring.text(),
                            name + "(" + String.join(", ", parameters) + ")",
                            file.toAbsolutePath().normalize(),
                            parameters,
                            functionMatcher.group(3)
                        ));
                    }
                    scopes.push(new Scope(indent, name, false));
                    i = docstring.nextLine();
                    continue;
                }
                i = end + 1;
                continue;
            }

            i = skipString(lines, i);
        }
        return units;
    }

    /**
     * Returns true for definitions at module level or directly inside a module-level class.
     */
    private static boolean isPublic(String name, Deque<Scope> scopes) {
        if (name.startsWith("_")) {
            return false;
        }
        if (scopes.isEmpty()) {
            return true;
        }
        Scope parent = scopes.peek();
        return parent.isClass() && scopes.size() == 1 && !parent.name().startsWith("_");
    }

    /**
     * Finds the line that closes the definition header (balanced parentheses, trailing colon).
     */
    private static int definitionEnd(List<String> lines, int start) {
        int depth = 0;
        for (int i = start; i < lines.size(); i++) {
            String code = stripComment(lines.get(i));
            for (char c : code.toCharArray()) {
                if (c == '(' || c == '[' || c == '{') {
                    depth++;
                } else if (c == ')' || c == ']' || c == '}') {
                    depth--;
                }
            }
            if (depth <= 0 && (code.trim().endsWith(":") || code.contains("):"))) {
                return i;
            }
        }
        return start;
    }

    private static String joinLines(List<String> lines, int start, int end) {
        StringBuilder joined = new StringBuilder();
        for (int i = start; i <= end; i++) {
            joined.append(stripComment(lines.get(i)).trim()).append(' ');
        }
        return joined.toString().trim();
    }

    private static String stripComment(String line) {
        int hash = line.indexOf('#');
        return hash >= 0 ? line.substring(0, hash) : line;
    }

    /**
     * Reads the docstring that immediately follows a definition header, if any.
     */
    private static Docstring readDocstring(List<String> lines, int start) {
        int i = start;
        while (i < lines.size() && lines.get(i).isBlank()) {
            i++;
        }
        if (i >= lines.size()) {
            return new Docstring(null, start);
        }

        String first = lines.get(i).trim();
        String quote = openingQuote(first);
        if (quote == null) {
            return new Docstring(null, start);
        }

        String body = first.substring(prefixLength(first) + quote.length());
        if (quote.length() == 1 || body.contains(quote)) {
            int close = body.indexOf(quote);
            String text = close >= 0 ? body.substring(0, close) : body;
            return new Docstring(text.trim(), i + 1);
        }

        List<String> docLines = new ArrayList<>();
        docLines.add(body);
        int j = i + 1;
        while (j < lines.size()) {
            String line = lines.get(j);
            int close = line.indexOf(quote);
            if (close >= 0) {
                docLines.add(line.substring(0, close));
                break;
            }
            docLines.add(line);
            j++;
        }
        return new Docstring(dedent(docLines), Math.min(j + 1, lines.size()));
    }

    private static String openingQuote(String line) {
        String unprefixed = line.substring(prefixLength(line));
        for (String quote : List.of("\"\"\"", "'''", "\"", "'")) {
            if (unprefixed.startsWith(quote)) {
                return quote;
            }
        }
        return null;
    }

    private static int prefixLength(String line) {
        int length = 0;
        while (length < line.length() && length < 2 && "rRuUbB".indexOf(line.charAt(length)) >= 0) {
            length++;
        }
        return length < line.length() && (line.charAt(length) == '"' || line.charAt(length) == '\'') ? length : 0;
    }

    /**
     * Removes the common leading whitespace of all lines after the first.
     */
    static String dedent(List<String> docLines) {
        int common = Integer.MAX_VALUE;
        for (int i = 1; i < docLines.size(); i++) {
            String line = docLines.get(i);
            if (!line.isBlank()) {
                common = Math.min(common, indentOf(line));
            }
        }
        List<String> result = new ArrayList<>();
        result.add(docLines.get(0).trim());
        for (int i = 1; i < docLines.size(); i++) {
            String line = docLines.get(i);
            result.add(line.isBlank() ? "" : line.substring(Math.min(common, indentOf(line))).stripTrailing());
        }
        return String.join("\n", result).strip();
    }

    /**
     * Skips over a triple-quoted string that starts on the given line.
     */
    private static int skipString(List<String> lines, int i) {
        String line = lines.get(i);
        for (String quote : List.of("\"\"\"", "'''")) {
            int open = line.indexOf(quote);
            if (open >= 0 && line.indexOf(quote, open + 3) < 0) {
                for (int j = i + 1; j < lines.size(); j++) {
                    if (lines.get(j).contains(quote)) {
                        return j + 1;
                    }
                }
                return lines.size();
            }
        }
        return i + 1;
    }

    private static int indentOf(String line) {
        int indent = 0;
        while (indent < line.length() && Character.isWhitespace(line.charAt(indent))) {
            indent++;
        }
        return indent;
    }

    /**
     * Parses parameter names, dropping annotations, defaults and bare {@code *} / {@code /} markers.
     */
    static List<String> parseParameters(String paramString, boolean dropReceiver) {
        List<String> parameters = new ArrayList<>();
        if (paramString == null || paramString.isBlank()) {
            return parameters;
        }

        for (String part : splitTopLevel(paramString)) {
            String trimmed = part.trim();
            int endIndex = trimmed.length();
            int colonIndex = trimmed.indexOf(':');
            int equalsIndex = trimmed.indexOf('=');
            if (colonIndex > 0) {
                endIndex = Math.min(endIndex, colonIndex);
            }
            if (equalsIndex > 0) {
                endIndex = Math.min(endIndex, equalsIndex);
            }
            String paramName = trimmed.substring(0, endIndex).trim();
            if (paramName.isEmpty() || paramName.equals("*") || paramName.equals("/")) {
                continue;
            }
            if (dropReceiver && parameters.isEmpty() && IMPLICIT_RECEIVERS.contains(paramName)) {
                dropReceiver = false;
                continue;
            }
            dropReceiver = false;
            parameters.add(paramName);
        }
        return parameters;
    }

    private static List<String> splitTopLevel(String paramString) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        StringBuilder current = new StringBuilder();
        for (char c : paramString.toCharArray()) {
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            }
            if (c == ',' && depth == 0) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        parts.add(current.toString());
        return parts;
    }

    /**
     * Derives the dotted module name of a file relative to a base directory.
     *
     * @param file Python file
     * @param base directory module names are relative to
     * @return dotted module name, e.g. {@code sdk.client}
     */
    static String moduleName(Path file, Path base) {
        Path relative = base.toAbsolutePath().normalize().relativize(file.toAbsolutePath().normalize());
        String dotted = relative.toString().replace('\\', '/').replaceAll("\\.py$", "").replace('/', '.');
        if (dotted.equals("__init__")) {
            return "";
        }
        return dotted.endsWith(".__init__") ? dotted.substring(0, dotted.length() - ".__init__".length()) : dotted;
    }

    // ==================== Dependencies ====================

    /**
     * Resolves import statements to sibling files.
     *
     * <p>Absolute imports are resolved against the file's directory and each of its
     * ancestors up to the root; relative imports against the package the dots point to.
     */
    @Override
    public List<Path> dependenciesOf(Path file, Path root) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file);
        } catch (IOException e) {
            log.warn("Failed to read {} for dependency resolution: {}", file, e.getMessage());
            return List.of();
        }

        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path directory = file.toAbsolutePath().normalize().getParent();
        Set<Path> candidates = new LinkedHashSet<>();
        for (String line : lines) {
            String trimmed = stripComment(line).trim();

            Matcher importMatcher = IMPORT_PATTERN.matcher(trimmed);
            if (importMatcher.matches()) {
                for (String module : importMatcher.group(1).split(",")) {
                    String name = module.trim().split("\\s+")[0];
                    candidates.addAll(resolveAbsolute(name, directory, normalizedRoot));
                }
                continue;
            }

            Matcher fromMatcher = FROM_IMPORT_PATTERN.matcher(trimmed);
            if (fromMatcher.matches()) {
                int dots = fromMatcher.group(1).length();
                String module = fromMatcher.group(2);
                List<String> names = importedNames(fromMatcher.group(3));
                if (dots > 0) {
                    Path packageDir = directory;
                    for (int i = 1; i < dots && packageDir != null; i++) {
                        packageDir = packageDir.getParent();
                    }
                    if (packageDir != null) {
                        candidates.addAll(moduleFiles(packageDir, module, names));
                    }
                } else {
                    for (Path base = directory; base != null && base.startsWith(normalizedRoot); base = base.getParent()) {
                        candidates.addAll(moduleFiles(base, module, names));
                    }
                }
            }
        }
        return existingDependencies(file, normalizedRoot, candidates);
    }

    private static List<Path> resolveAbsolute(String module, Path directory, Path root) {
        List<Path> resolved = new ArrayList<>();
        for (Path base = directory; base != null && base.startsWith(root); base = base.getParent()) {
            resolved.addAll(moduleFiles(base, module, List.of()));
        }
        return resolved;
    }

    private static List<String> importedNames(String clause) {
        List<String> names = new ArrayList<>();
        for (String part : clause.replace("(", "").replace(")", "").split(",")) {
            String name = part.trim().split("\\s+")[0];
            if (!name.isEmpty() && !name.equals("*")) {
                names.add(name);
            }
        }
        return names;
    }

    private static List<Path> moduleFiles(Path base, String module, List<String> importedNames) {
        List<Path> files = new ArrayList<>();
        Path moduleDir = module.isEmpty() ? base : base.resolve(module.replace('.', '/'));
        if (!module.isEmpty()) {
            files.add(moduleDir.resolveSibling(moduleDir.getFileName() + ".py"));
            files.add(moduleDir.resolve("__init__.py"));
        }
        for (String name : importedNames) {
            files.add(moduleDir.resolve(name + ".py"));
            files.add(moduleDir.resolve(name).resolve("__init__.py"));
        }
        return files;
    }

    private record Scope(int indent, String name, boolean isClass) {}

    private record Docstring(String text, int nextLine) {}
}
