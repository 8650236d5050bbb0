package com.docforge.core.discovery;

import com.docforge.core.model.DocumentableUnit;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.type.ClassOrInterfaceType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Discovers public Java methods using JavaParser.
 *
 * <p>Every public method of a public type (top-level or nested) is a unit. Methods of
 * interfaces are public unless declared private. The Javadoc description becomes the
 * unit's docstring.
 *
 * <p>Dependencies are resolved from single-type, static and on-demand imports and from
 * types referenced in the same package, provided the target source file lies within the
 * discovery root.
 */
public class JavaUnitDiscovery extends AbstractUnitDiscovery {

    private final JavaParser javaParser;

    public JavaUnitDiscovery() {
        super();
        this.javaParser = new JavaParser(new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    @Override
    public String getId() {
        return "java";
    }

    @Override
    protected String extension() {
        return "java";
    }

    @Override
    protected List<DocumentableUnit> parseFile(Path file, Path base) throws IOException {
        Optional<CompilationUnit> parsed = parseJavaFile(file);
        if (parsed.isEmpty()) {
            return List.of();
        }
        CompilationUnit cu = parsed.get();
        String packageName = cu.getPackageDeclaration().map(p -> p.getNameAsString()).orElse("");

        List<DocumentableUnit> units = new ArrayList<>();
        for (TypeDeclaration<?> type : cu.getTypes()) {
            collectUnits(type, packageName, file.toAbsolutePath().normalize(), units);
        }
        return units;
    }

    /**
     * Parses a Java source file into a CompilationUnit AST.
     *
     * @param file path to Java source file
     * @return CompilationUnit if parsing succeeded, empty otherwise
     * @throws IOException if file cannot be read
     */
    private Optional<CompilationUnit> parseJavaFile(Path file) throws IOException {
        String content = Files.readString(file);
        ParseResult<CompilationUnit> result;
        synchronized (javaParser) {
            result = javaParser.parse(content);
        }
        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult();
        }
        log.debug("Failed to parse Java file: {}", file);
        result.getProblems().forEach(problem -> log.debug("  - {}", problem));
        return Optional.empty();
    }

    private void collectUnits(TypeDeclaration<?> type, String owner, Path file, List<DocumentableUnit> units) {
        boolean isInterface = type instanceof ClassOrInterfaceDeclaration declaration && declaration.isInterface();
        if (!type.isPublic() && !isInterface) {
            return;
        }
        String module = owner.isEmpty() ? type.getNameAsString() : owner + "." + type.getNameAsString();

        for (MethodDeclaration method : type.getMethods()) {
            boolean visible = method.isPublic() || (isInterface && !method.isPrivate());
            if (!visible) {
                continue;
            }
            List<String> parameters = method.getParameters().stream()
                .map(Parameter::getNameAsString)
                .toList();
            String signature = method.getNameAsString() + "(" + String.join(", ",
                method.getParameters().stream().map(p -> p.getTypeAsString() + " " + p.getNameAsString()).toList()) + ")";
            String docstring = method.getJavadoc()
                .map(javadoc -> javadoc.getDescription().toText().strip())
                .filter(text -> !text.isEmpty())
                .orElse(null);
            units.add(new DocumentableUnit(
                method.getNameAsString(),
                module,
                docstring,
                signature,
                file,
                parameters,
                method.getTypeAsString()
            ));
        }

        for (BodyDeclaration<?> member : type.getMembers()) {
            if (member instanceof TypeDeclaration<?> nested) {
                collectUnits(nested, module, file, units);
            }
        }
    }

    // ==================== Dependencies ====================

    @Override
    public List<Path> dependenciesOf(Path file, Path root) {
        Optional<CompilationUnit> parsed;
        try {
            parsed = parseJavaFile(file);
        } catch (IOException e) {
            log.warn("Failed to read {} for dependency resolution: {}", file, e.getMessage());
            return List.of();
        }
        if (parsed.isEmpty()) {
            return List.of();
        }

        CompilationUnit cu = parsed.get();
        Path directory = file.toAbsolutePath().normalize().getParent();
        String packageName = cu.getPackageDeclaration().map(p -> p.getNameAsString()).orElse("");
        Path sourceRoot = sourceRootOf(directory, packageName);

        Set<Path> candidates = new LinkedHashSet<>();
        for (ImportDeclaration imported : cu.getImports()) {
            String name = imported.getNameAsString();
            if (imported.isAsterisk()) {
                if (!imported.isStatic()) {
                    candidates.addAll(javaFilesIn(sourceRoot.resolve(name.replace('.', '/'))));
                } else {
                    candidates.add(sourceRoot.resolve(name.replace('.', '/') + ".java"));
                }
                continue;
            }
            candidates.add(sourceRoot.resolve(name.replace('.', '/') + ".java"));
            int lastDot = name.lastIndexOf('.');
            if (imported.isStatic() && lastDot > 0) {
                candidates.add(sourceRoot.resolve(name.substring(0, lastDot).replace('.', '/') + ".java"));
            }
        }
        for (ClassOrInterfaceType referenced : cu.findAll(ClassOrInterfaceType.class)) {
            candidates.add(directory.resolve(referenced.getNameAsString() + ".java"));
        }
        return existingDependencies(file, root.toAbsolutePath().normalize(), candidates);
    }

    /**
     * Strips the package directories from a file's directory.
     */
    private static Path sourceRootOf(Path directory, String packageName) {
        if (packageName.isEmpty()) {
            return directory;
        }
        Path packagePath = Path.of(packageName.replace('.', '/'));
        if (!directory.endsWith(packagePath)) {
            return directory;
        }
        Path root = directory;
        for (int i = 0; i < packagePath.getNameCount() && root.getParent() != null; i++) {
            root = root.getParent();
        }
        return root;
    }

    private List<Path> javaFilesIn(Path packageDirectory) {
        if (!Files.isDirectory(packageDirectory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(packageDirectory)) {
            return files.filter(this::supports).sorted().toList();
        } catch (IOException e) {
            log.debug("Failed to list {}: {}", packageDirectory, e.getMessage());
            return List.of();
        }
    }
}
