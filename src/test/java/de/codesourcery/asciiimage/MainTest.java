/**
 * Copyright 2015 Tobias Gierke <tobias.gierke@code-sourcery.de>
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.codesourcery.asciiimage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import javax.imageio.ImageIO;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/// Tests for the command line front end.
public class MainTest {

    @TempDir
    Path tempDir;

    private Path imageFile;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        imageFile = tempDir.resolve("half.png");
        ImageIO.write(ImageToAsciiTest.halfWhite(4, 2), "png", imageFile.toFile());
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(Map<String, String> environment, String... args) {
        CommandLine commandLine = Main.createCommandLine(new Main(environment));
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    private int run(String... args) {
        return run(Map.of(), args);
    }

    @Test
    void testExplicitSize() {
        int exitCode = run("-W", "2", "-H", "1", "-g", " @", imageFile.toString());

        assertThat(exitCode).isEqualTo(Main.EXIT_OK);
        assertThat(out.toString()).isEqualTo("@ \n");
    }

    @Test
    void testFitsIntoTerminalSize() {
        int exitCode = run(Map.of("COLUMNS", "4", "LINES", "4"), "--gradient", " @", imageFile.toString());

        assertThat(exitCode).isEqualTo(Main.EXIT_OK);
        assertThat(out.toString()).isEqualTo("@@  \n");
    }

    @Test
    void testWidthOnlyDerivesHeight() {
        int exitCode = run("--width", "4", "--char-aspect", "1", "-g", " @", imageFile.toString());

        assertThat(exitCode).isEqualTo(Main.EXIT_OK);
        assertThat(out.toString()).isEqualTo("@@  \n@@  \n");
    }

    @Test
    void testNoFitUsesTerminalSize() {
        int exitCode = run(Map.of("COLUMNS", "2", "LINES", "2"), "--no-fit", "--raw", imageFile.toString());

        assertThat(exitCode).isEqualTo(Main.EXIT_OK);
        assertThat(out.toString()).isEqualTo("[255, 0]\n[255, 0]\n");
    }

    @Test
    void testInvertAndCrop() {
        int exitCode = run("-W", "4", "-H", "1", "-g", " @", "--invert", "--crop", imageFile.toString());

        assertThat(exitCode).isEqualTo(Main.EXIT_OK);
        assertThat(out.toString()).isEqualTo("  @@\n");
    }

    @Test
    void testThresholds() {
        int exitCode = run("-W", "1", "-H", "1", "--raw", "--white-threshold", "100", imageFile.toString());

        // (255 + 255 + 0 + 0) / 4 = 127, pushed to white
        assertThat(exitCode).isEqualTo(Main.EXIT_OK);
        assertThat(out.toString()).isEqualTo("[255]\n");
    }

    @Test
    void testWritesOutputFile() throws IOException {
        Path target = tempDir.resolve("out.txt");

        int exitCode = run("-W", "2", "-H", "1", "-g", " @", "-o", target.toString(), imageFile.toString());

        assertThat(exitCode).isEqualTo(Main.EXIT_OK);
        assertThat(out.toString()).isEmpty();
        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("@ \n");
    }

    @Test
    void testZeroSizeProducesNoOutput() {
        int exitCode = run("-W", "0", "-H", "0", imageFile.toString());

        assertThat(exitCode).isEqualTo(Main.EXIT_OK);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testMissingFileIsReported() {
        int exitCode = run(tempDir.resolve("nope.png").toString());

        assertThat(exitCode).isEqualTo(Main.EXIT_FAILURE);
        assertThat(err.toString()).contains("File not found");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testClipboardFailureWhenHeadless() {
        assumeTrue(GraphicsEnvironment.isHeadless());

        int exitCode = run();

        assertThat(exitCode).isEqualTo(Main.EXIT_FAILURE);
        assertThat(err.toString()).contains("error:");
    }

    @Test
    void testInvalidOptionsAreUsageErrors() {
        assertThat(run("-W", "-3", imageFile.toString())).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(run("--char-aspect", "0", imageFile.toString())).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(run("--black-threshold", "300", imageFile.toString())).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(run("--no-such-option")).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    @Test
    void testOversizedOutputIsUsageError() {
        assertThat(run("-W", "100000", "-H", "100000", imageFile.toString())).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testCommandLineKeepsPicocliDefaults() {
        CommandLine commandLine = Main.createCommandLine(new Main());

        assertThat(commandLine.isCaseInsensitiveEnumValuesAllowed()).isFalse();
        assertThat(commandLine.getExecutionExceptionHandler()).isNotNull();
    }
}
