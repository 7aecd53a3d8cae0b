package io.cflow.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything extracted from one successfully parsed file.
 *
 * @param file        The source file path
 * @param classes     Class declarations in source order
 * @param definitions Definitions in source order
 */
public record ExtractedFile(Path file, List<ClassDeclaration> classes, List<ExtractedDefinition> definitions) {
    public ExtractedFile {
        classes = classes == null ? List.of() : List.copyOf(classes);
        definitions = definitions == null ? List.of() : List.copyOf(definitions);
    }

    public int callSiteCount() {
        return definitions.stream().mapToInt(d -> d.callSites().size()).sum();
    }
}
