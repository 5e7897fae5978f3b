package com.mermaiduml.core.renderer;

import java.util.List;

/**
 * Writes rendered diagram files to a destination.
 *
 * <p>Implementations are registered in
 * {@code META-INF/services/com.mermaiduml.core.renderer.OutputRenderer}.
 */
public interface OutputRenderer {

    /**
     * Returns the renderer identifier ("filesystem", "console").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the files in order.
     *
     * @param files diagram files
     * @param target destination settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(List<DiagramFile> files, RenderTarget target);
}
