package org.pragmatica.exformat.shared;

import java.nio.file.Path;

/**
 * Source text together with the path it was read from.
 */
public record SourceFile(Path path, String content) {
    public SourceFile withContent(String content) {
        return new SourceFile(path, content);
    }

    public String fileName() {
        var name = path.getFileName();
        return name == null
               ? path.toString()
               : name.toString();
    }
}
