package org.pragmatica.exformat.ast;

/**
 * Layout metadata attached to a node.
 * <p>
 * {@code line}, {@code endLine} and {@code prevLine} are 1-based; 0 means unknown.
 * The parser fills {@code line} (and {@code endLine} where it knows the closing
 * delimiter); the annotation pass fills the rest.
 */
public record Meta(int line,
                   int endLine,
                   int prevLine,
                   String prefixComments,
                   boolean prefixBlank,
                   String suffixComments) {
    public static final Meta NONE = new Meta(0, 0, 0, "", false, "");

    public Meta {
        prefixComments = prefixComments == null ? "" : prefixComments;
        suffixComments = suffixComments == null ? "" : suffixComments;
    }

    public static Meta at(int line) {
        return new Meta(line, 0, 0, "", false, "");
    }

    public static Meta spanning(int line, int endLine) {
        return new Meta(line, endLine, 0, "", false, "");
    }

    public boolean hasLine() {
        return line > 0;
    }

    public boolean hasPrevLine() {
        return prevLine > 0;
    }

    /**
     * True when the node starts on a later line than the node visited before it.
     */
    public boolean startsBelowPrevious() {
        return hasLine() && hasPrevLine() && line > prevLine;
    }

    public Meta withLine(int line) {
        return new Meta(line, endLine, prevLine, prefixComments, prefixBlank, suffixComments);
    }

    public Meta withEndLine(int endLine) {
        return new Meta(line, endLine, prevLine, prefixComments, prefixBlank, suffixComments);
    }

    public Meta withPrevLine(int prevLine) {
        return new Meta(line, endLine, prevLine, prefixComments, prefixBlank, suffixComments);
    }

    public Meta withPrefix(String prefixComments, boolean prefixBlank) {
        return new Meta(line, endLine, prevLine, prefixComments, prefixBlank, suffixComments);
    }

    public Meta withSuffixComments(String suffixComments) {
        return new Meta(line, endLine, prevLine, prefixComments, prefixBlank, suffixComments);
    }
}
