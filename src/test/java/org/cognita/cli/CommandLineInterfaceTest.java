package org.cognita.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.cognita.runtime.isa.Instruction;
import org.cognita.runtime.services.BehaviorModelWriter;
import org.cognita.runtime.services.ModelBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine commandLine;
    private Level rootLevel;

    @BeforeEach
    void setUp() {
        commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        rootLevel = root().getLevel();
    }

    @AfterEach
    void restoreRootLevel() {
        root().setLevel(rootLevel);
    }

    private static Logger root() {
        return ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(Logger.ROOT_LOGGER_NAME);
    }

    @Test
    void runPrintsUpdatesAndSummary() throws IOException {
        Path document = tempDir.resolve("moth.yaml");
        Files.writeString(document, """
                flows:
                  main:
                    - set_feeling: {name: curiosity, value: 0.7}
                    - self_terminate: {reason: done}
                """);

        int exitCode = commandLine.execute("run", "--ticks", "5", "--tick-ms", "10", document.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("\"curiosity\":0.7")
                .contains("\"status\":\"STOPPED\"")
                .contains("\"iterations\":1");
    }

    @Test
    void runRejectsInvalidDocument() throws IOException {
        Path document = tempDir.resolve("broken.yaml");
        Files.writeString(document, "flows: [");

        int exitCode = commandLine.execute("run", document.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Invalid behavior document");
    }

    @Test
    void disasmPrintsListing() throws IOException {
        Path model = tempDir.resolve("model.bin");
        Files.write(model, new BehaviorModelWriter().write(new ModelBuilder()
                .output("eat")
                .continuationPoint("choose", 2000, "end")
                .pushConst(0.5).setOutput("eat")
                .atContinuationPoint(Instruction.CONTINUATION_POINT, "choose")
                .label("end")
                .build()));

        int exitCode = commandLine.execute("disasm", model.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("out:eat").contains("cp:choose");
    }

    @Test
    void disasmReportsCorruptModel() throws IOException {
        Path model = tempDir.resolve("garbage.bin");
        Files.write(model, new byte[]{1, 2, 3});

        assertThat(commandLine.execute("disasm", model.toString())).isEqualTo(2);
        assertThat(err.toString()).contains("Model is corrupt");
    }
}
