package com.mermaiduml.core.renderer.impl;

import com.mermaiduml.core.renderer.DiagramFile;
import com.mermaiduml.core.renderer.OutputRenderer;
import com.mermaiduml.core.renderer.RenderTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints diagram files to a console stream.
 *
 * <p>With headers off only the raw documents are printed, so the output can be
 * redirected into a Markdown file.
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final int LINE_WIDTH = 80;

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = out;
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(List<DiagramFile> files, RenderTarget target) {
        logger.debug("Printing {} diagram files (headers: {})", files.size(), target.showHeaders());

        String separatorLine = target.separator().repeat(Math.max(1, LINE_WIDTH / target.separator().length()));
        for (int i = 0; i < files.size(); i++) {
            DiagramFile file = files.get(i);
            if (i > 0) {
                out.println(separatorLine);
            }
            if (target.showHeaders()) {
                out.println("File " + (i + 1) + "/" + files.size() + ": " + file.fileName());
                out.println();
            }
            out.print(file.content());
        }
        out.flush();
    }
}
