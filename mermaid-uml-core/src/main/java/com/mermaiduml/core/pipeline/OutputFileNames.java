package com.mermaiduml.core.pipeline;

import com.mermaiduml.core.config.DiagramOptions;

/**
 * Builds diagram file names that encode the active switches, e.g.
 * {@code Zoo_NoEnums_WithNamespaces.md}.
 */
public final class OutputFileNames {

    private OutputFileNames() {
    }

    /**
     * Returns the file name for a project diagram.
     *
     * @param projectName project name
     * @param options active diagram options
     * @param extension file extension without leading dot
     * @return file name
     */
    public static String forProject(String projectName, DiagramOptions options, String extension) {
        StringBuilder name = new StringBuilder(projectName);
        if (options.excludeClasses()) {
            name.append("_NoClasses");
        }
        if (options.excludeInterfaces()) {
            name.append("_NoInterfaces");
        }
        if (options.excludeEnums()) {
            name.append("_NoEnums");
        }
        if (options.nestedInheritance()) {
            name.append("_NestedInheritance");
        }
        if (options.groupByNamespace()) {
            name.append("_WithNamespaces");
        }
        return name.append('.').append(extension).toString();
    }
}
