package ai.pyflow.scan;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.pyflow.TestFiles;

public class PythonParserTest {

    @TempDir
    Path tmp;

    @Test
    void parsesValidFile() throws Exception {
        final Path file = TestFiles.write(tmp, "ok.py",
                "import os",
                "",
                "def main():",
                "    print(os.getcwd())");
        final ParsedSource parsed = new PythonParser().parse(file);

        assertEquals(file, parsed.file());
        assertEquals("module", parsed.root().getType());
        assertFalse(parsed.root().hasError());
    }

    @Test
    void rejectsInvalidSyntaxWithPosition() throws Exception {
        final Path file = TestFiles.write(tmp, "broken.py",
                "def ok():",
                "    pass",
                "",
                "def broken(:",
                "    pass");
        final PythonParser parser = new PythonParser();

        final SourceParseException ex = assertThrows(SourceParseException.class, () -> parser.parse(file));
        assertEquals(file, ex.file());
        assertTrue(ex.getMessage().contains("line"), "message: " + ex.getMessage());
    }

    @Test
    void rejectsUndecodableBytes() throws Exception {
        final Path file = tmp.resolve("latin1.py");
        Files.write(file, new byte[] {'x', ' ', '=', ' ', '"', (byte) 0xE9, (byte) 0xFF, '"', '\n'});

        final SourceParseException ex = assertThrows(SourceParseException.class, () -> new PythonParser().parse(file));
        assertTrue(ex.getMessage().contains("UTF-8"), "message: " + ex.getMessage());
    }

    @Test
    void stripsByteOrderMarkAndSlicesMultibyteText() throws Exception {
        final Path file = tmp.resolve("bom.py");
        Files.writeString(file, "\uFEFF# café\ndef grüß():\n    pass\n", StandardCharsets.UTF_8);
        final ParsedSource parsed = new PythonParser().parse(file);

        String name = null;
        for (int i = 0; i < parsed.root().getNamedChildCount(); i++) {
            final var child = parsed.root().getNamedChild(i);
            if (PythonNodeTypes.FUNCTION_DEFINITION.equals(child.getType())) {
                name = TreeNodes.definitionName(child, parsed.source());
            }
        }
        assertEquals("grüß", name);
    }

    @Test
    void parserIsReusableAfterFailure() throws Exception {
        final PythonParser parser = new PythonParser();
        final Path bad = TestFiles.write(tmp, "bad.py", "class (:");
        final Path good = TestFiles.write(tmp, "good.py", "class Good:", "    pass");

        assertThrows(SourceParseException.class, () -> parser.parse(bad));
        assertDoesNotThrow(() -> parser.parse(good));
    }
}
