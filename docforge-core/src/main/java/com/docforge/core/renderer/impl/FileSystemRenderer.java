package com.docforge.core.renderer.impl;

import com.docforge.core.renderer.GeneratedFile;
import com.docforge.core.renderer.GeneratedOutput;
import com.docforge.core.renderer.OutputRenderer;
import com.docforge.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renderer that writes generated files below a directory, overwriting existing files.
 *
 * <p>Parent directories are created on demand. Any I/O failure is reported as an
 * {@link IllegalStateException} carrying the offending path, so callers that treat
 * rendering as part of build success (reports) can propagate it.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * GeneratedOutput output = GeneratedOutput.of(
 *     GeneratedFile.markdown("test_report.md", "# Test Execution Report\n")
 * );
 * new FileSystemRenderer().render(output, RenderContext.of(Path.of("docs/reports")));
 * // Creates: docs/reports/test_report.md
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = context.outputDirectory();
        logger.debug("Rendering {} files to {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file);
        }
        logger.info("Rendered {} files to {}", output.files().size(), outputDir);
    }

    private void writeFile(Path outputDir, GeneratedFile file) {
        Path targetPath = outputDir.resolve(file.relativePath()).normalize();
        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(targetPath, file.content(), StandardCharsets.UTF_8);
            logger.debug("Wrote file: {} ({} chars)", file.relativePath(), file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + targetPath, e);
        }
    }
}
