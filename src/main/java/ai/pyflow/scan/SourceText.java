package ai.pyflow.scan;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import org.treesitter.TSNode;

/**
 * Source text plus its UTF-8 bytes. tree-sitter reports UTF-8 byte offsets, so node text
 * is cut from the byte array, not from the Java string.
 */
public final class SourceText {

    private static final char BOM = '\uFEFF';

    private final String text;
    private final byte[] utf8;

    private SourceText(String text) {
        this.text = text;
        this.utf8 = text.getBytes(StandardCharsets.UTF_8);
    }

    public static SourceText of(String text) {
        Objects.requireNonNull(text, "text");
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            return new SourceText(text.substring(1));
        }
        return new SourceText(text);
    }

    public String text() {
        return text;
    }

    public String slice(TSNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        return slice(node.getStartByte(), node.getEndByte());
    }

    public String slice(int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte || startByte >= utf8.length) {
            return "";
        }
        final int end = Math.min(endByte, utf8.length);
        return new String(utf8, startByte, end - startByte, StandardCharsets.UTF_8);
    }
}
