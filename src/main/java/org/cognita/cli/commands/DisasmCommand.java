package org.cognita.cli.commands;

import org.cognita.runtime.model.BehaviorModel;
import org.cognita.runtime.model.ModelCorruptionException;
import org.cognita.runtime.services.BehaviorModelReader;
import org.cognita.runtime.services.Disassembler;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "disasm",
    description = "Verify a bytecode behavior model and print its disassembly"
)
public class DisasmCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Path to the binary model file")
    private Path modelFile;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(modelFile);
        } catch (IOException e) {
            err.println("Cannot read " + modelFile + ": " + e.getMessage());
            return 1;
        }
        BehaviorModel model;
        try {
            model = new BehaviorModelReader().read(bytes);
        } catch (ModelCorruptionException e) {
            err.println("Model is corrupt: " + e.getMessage());
            return 2;
        }
        out.print(new Disassembler().render(model));
        out.flush();
        return 0;
    }
}
