package com.docforge.core.discovery;

import com.docforge.core.model.DocumentableUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link JavaUnitDiscovery}.
 */
class JavaUnitDiscoveryTest {

    @TempDir
    Path tempDir;

    private JavaUnitDiscovery discovery;

    @BeforeEach
    void setUp() {
        discovery = new JavaUnitDiscovery();
    }

    private Path write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    void discover_publicMethods_extractsUnitsWithJavadoc() throws Exception {
        write("src/main/java/com/acme/api/Client.java", """
            package com.acme.api;

            public class Client {

                /**
                 * Opens a connection to the given host.
                 *
                 * @param host server name
                 * @param port server port
                 * @return a session
                 */
                public Session connect(String host, int port) {
                    return new Session();
                }

                public void close() {
                }

                void packagePrivate() {
                }

                private void hidden() {
                }
            }
            """);

        List<DocumentableUnit> units = discovery.discover(tempDir, List.of());

        assertThat(units).extracting(DocumentableUnit::name).containsExactly("connect", "close");
        DocumentableUnit connect = units.get(0);
        assertThat(connect.module()).isEqualTo("com.acme.api.Client");
        assertThat(connect.qualifiedName()).isEqualTo("com.acme.api.Client.connect");
        assertThat(connect.docstring()).isEqualTo("Opens a connection to the given host.");
        assertThat(connect.parameters()).containsExactly("host", "port");
        assertThat(connect.signature()).isEqualTo("connect(String host, int port)");
        assertThat(connect.returnType()).isEqualTo("Session");
        assertThat(connect.language()).isEqualTo("java");
        assertThat(units.get(1).hasDocstring()).isFalse();
    }

    @Test
    void discover_interfaceMethods_arePublicUnlessPrivate() throws Exception {
        write("src/Store.java", """
            package store;

            interface Store {
                String get(String key);

                default String getOrEmpty(String key) {
                    return helper(key);
                }

                private String helper(String key) {
                    return key;
                }
            }
            """);

        List<DocumentableUnit> units = discovery.discover(tempDir, List.of());

        assertThat(units).extracting(DocumentableUnit::name).containsExactly("get", "getOrEmpty");
    }

    @Test
    void discover_nestedTypes_qualifiesModuleWithOuterType() throws Exception {
        write("src/Outer.java", """
            package demo;

            public class Outer {
                public static class Builder {
                    public Outer build() {
                        return new Outer();
                    }
                }

                static class Internal {
                    public void ignored() {
                    }
                }
            }
            """);

        List<DocumentableUnit> units = discovery.discover(tempDir, List.of());

        assertThat(units).extracting(DocumentableUnit::qualifiedName).containsExactly("demo.Outer.Builder.build");
    }

    @Test
    void discover_nonPublicClassAndTestSources_areSkipped() throws Exception {
        write("src/Hidden.java", """
            class Hidden {
                public void run() {
                }
            }
            """);
        write("src/test/java/VisibleTest.java", """
            public class VisibleTest {
                public void testRun() {
                }
            }
            """);

        assertThat(discovery.discover(tempDir, List.of())).isEmpty();
    }

    @Test
    void discover_unparseableFile_isSkipped() throws Exception {
        write("src/Broken.java", "public class Broken { public void run( }");
        write("src/Fine.java", """
            public class Fine {
                public void run() {
                }
            }
            """);

        List<DocumentableUnit> units = discovery.discover(tempDir, List.of());

        assertThat(units).extracting(DocumentableUnit::qualifiedName).containsExactly("Fine.run");
    }

    @Test
    void dependenciesOf_importsAndSamePackageReferences_resolvesFilesInsideRoot() throws Exception {
        Path client = write("src/main/java/com/acme/api/Client.java", """
            package com.acme.api;

            import java.util.List;
            import com.acme.model.Model;

            public class Client {
                public Session open(List<Model> models) {
                    return new Session();
                }
            }
            """);
        Path session = write("src/main/java/com/acme/api/Session.java", """
            package com.acme.api;

            public class Session {
            }
            """);
        Path model = write("src/main/java/com/acme/model/Model.java", """
            package com.acme.model;

            public class Model {
            }
            """);
        write("src/main/java/com/acme/api/Unrelated.java", """
            package com.acme.api;

            public class Unrelated {
            }
            """);

        List<Path> dependencies = discovery.dependenciesOf(client, tempDir);

        assertThat(dependencies).containsExactlyInAnyOrder(
            model.toAbsolutePath().normalize(),
            session.toAbsolutePath().normalize());
    }

    @Test
    void dependenciesOf_wildcardImport_includesEveryFileOfPackage() throws Exception {
        Path client = write("src/com/acme/api/Client.java", """
            package com.acme.api;

            import com.acme.model.*;

            public class Client {
            }
            """);
        Path first = write("src/com/acme/model/First.java", "package com.acme.model;\npublic class First {}\n");
        Path second = write("src/com/acme/model/Second.java", "package com.acme.model;\npublic class Second {}\n");

        assertThat(discovery.dependenciesOf(client, tempDir)).containsExactly(
            first.toAbsolutePath().normalize(),
            second.toAbsolutePath().normalize());
    }

    @Test
    void supports_javaExtensionOnly() {
        assertThat(discovery.supports(Path.of("A.java"))).isTrue();
        assertThat(discovery.supports(Path.of("a.py"))).isFalse();
        assertThat(discovery.getId()).isEqualTo("java");
    }
}
