package edu.kit.kastel.vads.flowchart;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {
    @TempDir
    Path directory;

    private Path source(String text) throws IOException {
        return Files.writeString(this.directory.resolve("input.pas"), text);
    }

    @Test
    void writesCodeWithTrailingNewline() throws IOException {
        Path input = source("begin a := 1 end.");
        Path output = this.directory.resolve("out.c");
        assertEquals(0, Main.run(new String[] {input.toString(), output.toString()}));
        assertEquals(new Translator().translate("begin a := 1 end.").code() + "\n", Files.readString(output));
    }

    @Test
    void honorsLoopStyleAndWritesDot() throws IOException {
        Path input = source("begin while a < 5 do a := a + 1 end.");
        Path output = this.directory.resolve("out.c");
        Path dot = this.directory.resolve("graph.dot");
        int status = Main.run(new String[] {
            "--loops=structured", "--dot", dot.toString(), input.toString(), output.toString()
        });
        assertEquals(0, status);
        assertTrue(Files.readString(output).contains("while ((a < 5)) {"));
        assertTrue(Files.readString(dot).startsWith("digraph"));
    }

    @Test
    void translationErrorsExitWith42() throws IOException {
        Path input = source("begin a := end.");
        Path output = this.directory.resolve("out.c");
        assertEquals(Main.EXIT_TRANSLATION_ERROR, Main.run(new String[] {input.toString(), output.toString()}));
        assertFalse(Files.exists(output));
    }

    @Test
    void usageErrors() throws IOException {
        String input = source("begin end.").toString();
        String output = this.directory.resolve("out.c").toString();
        assertEquals(Main.EXIT_USAGE, Main.run(new String[] {input}));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[] {"--loops=goto", input, output}));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[] {input, output, "--dot"}));
        assertEquals(Main.EXIT_USAGE, Main.run(new String[] {"--verbose", input, output}));
    }

    @Test
    void missingInputIsAnIoError() {
        String input = this.directory.resolve("missing.pas").toString();
        String output = this.directory.resolve("out.c").toString();
        assertThrows(NoSuchFileException.class, () -> Main.run(new String[] {input, output}));
    }
}
