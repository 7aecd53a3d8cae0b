package io.cflow.parser;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;

/**
 * Source text together with its UTF-8 bytes. Tree-sitter reports byte offsets,
 * which only match character offsets for ASCII files, so node text is always
 * cut from the byte array.
 */
public final class SourceText {
    private static final Logger log = LogManager.getLogger(SourceText.class);

    private final String text;
    private final byte[] utf8Bytes;

    private SourceText(String text, byte[] utf8Bytes) {
        this.text = text;
        this.utf8Bytes = utf8Bytes;
    }

    public static SourceText of(String text) {
        String stripped = text.startsWith("\uFEFF") ? text.substring(1) : text;
        return new SourceText(stripped, stripped.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Text in the byte range [startByte, endByte). Out-of-range requests are
     * clamped; a negative or inverted range yields the empty string.
     */
    public String substring(int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte) {
            log.warn("Invalid byte range [{}, {}) for source of {} bytes", startByte, endByte, utf8Bytes.length);
            return "";
        }
        if (startByte >= utf8Bytes.length) {
            return "";
        }
        int end = Math.min(endByte, utf8Bytes.length);
        return new String(utf8Bytes, startByte, end - startByte, StandardCharsets.UTF_8);
    }

    /**
     * Text covered by a node, or the empty string for a null node.
     */
    public String text(TSNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        return substring(node.getStartByte(), node.getEndByte());
    }

    public String text() {
        return text;
    }

    public byte[] utf8Bytes() {
        return utf8Bytes;
    }

    public int byteLength() {
        return utf8Bytes.length;
    }
}
