package com.docforge.core.renderer;

/**
 * Writes a {@link GeneratedOutput} to a destination.
 *
 * <p>Used for both permanent outputs of a build: the API pages under the docs directory
 * and the test and validation reports under the reports directory.
 *
 * @see com.docforge.core.renderer.impl.FileSystemRenderer
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer, e.g. {@code "filesystem"}.
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Renders every file of the output.
     *
     * @param output files to write
     * @param context destination and settings
     * @throws IllegalStateException if a file cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
