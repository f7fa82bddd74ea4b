package org.cognita.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.typesafe.config.Config;
import org.cognita.actor.ActorRunner;
import org.cognita.actor.ActorRuntime;
import org.cognita.actor.ActorStateUpdate;
import org.cognita.actor.ActorTemplate;
import org.cognita.actor.IActorStateListener;
import org.cognita.cli.CommandLineInterface;
import org.cognita.config.ConfigLoader;
import org.cognita.document.DocumentParseException;
import org.cognita.store.InMemoryModelStore;
import org.cognita.store.InMemoryStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

@Command(
    name = "run",
    description = "Run a single actor over a behavior document and print its state updates"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunCommand.class);
    private static final String ACTOR_ID = "cli-actor";

    @Parameters(index = "0", description = "Path to the YAML behavior document")
    private Path documentFile;

    @Option(names = {"-f", "--flow"}, description = "Flow to run each tick when the document has no process_tick (default: entry flow)")
    private String flow;

    @Option(names = {"-n", "--ticks"}, description = "Number of ticks to run (default: ${DEFAULT-VALUE})", defaultValue = "10")
    private int ticks;

    @Option(names = {"-t", "--tick-ms"}, description = "Tick interval in milliseconds (default: ${DEFAULT-VALUE})", defaultValue = "100")
    private long tickMs;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (ticks <= 0 || tickMs <= 0) {
            err.println("--ticks and --tick-ms must be positive");
            return 2;
        }
        byte[] content;
        try {
            content = Files.readAllBytes(documentFile);
        } catch (IOException e) {
            err.println("Cannot read " + documentFile + ": " + e.getMessage());
            return 1;
        }

        Config config = ConfigLoader.cognita(parent.getConfig());
        String reference = documentFile.getFileName().toString();
        InMemoryModelStore models = new InMemoryModelStore();
        try {
            saveSiblings(models);
        } catch (IOException e) {
            err.println("Cannot read documents next to " + documentFile + ": " + e.getMessage());
            return 1;
        }
        models.save(reference, content);

        ActorRuntime runtime = new ActorRuntime(config, models, new InMemoryStateStore());
        runtime.addStateListener(new IActorStateListener() {
            @Override
            public void onStateUpdate(ActorStateUpdate update) {
                out.println(toJson(update));
                out.flush();
            }
        });
        try {
            ActorTemplate template = runtime.newTemplate("cli", reference)
                    .withTickInterval(Duration.ofMillis(tickMs))
                    .withStartFlow(flow);
            ActorRunner runner;
            try {
                runner = runtime.spawn(ACTOR_ID, template);
            } catch (DocumentParseException e) {
                err.println("Invalid behavior document " + documentFile + ": " + e.getMessage());
                return 1;
            }
            while (runner.getIteration() < ticks && !runner.getStatus().isTerminal()) {
                Thread.sleep(tickMs);
            }
            runtime.stop(ACTOR_ID, true);
            runner.awaitTermination(Duration.ofMillis(tickMs * 10));

            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("status", runner.getStatus());
            summary.put("iterations", runner.getIteration());
            summary.put("feelings", runner.getFeelings());
            summary.put("memories", runner.getMemories());
            summary.put("variables", runner.getVariables());
            summary.put("errors", runner.getErrors().size());
            if (runner.getLastFault() != null) {
                summary.put("lastFault", runner.getLastFault());
            }
            out.println(toJson(summary));
            out.flush();
            LOGGER.debug("Run of {} finished after {} ticks", reference, runner.getIteration());
            return runner.getLastFault() == null ? 0 : 3;
        } finally {
            runtime.shutdown();
        }
    }

    // imports refer to other documents by file name, relative to the document's directory
    private void saveSiblings(InMemoryModelStore models) throws IOException {
        Path directory = documentFile.toAbsolutePath().getParent();
        if (directory == null) {
            return;
        }
        List<Path> siblings;
        try (Stream<Path> files = Files.list(directory)) {
            siblings = files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".yml") || p.getFileName().toString().endsWith(".yaml"))
                    .toList();
        }
        for (Path sibling : siblings) {
            models.save(sibling.getFileName().toString(), Files.readAllBytes(sibling));
        }
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            LOGGER.warn("Cannot render {} as JSON: {}", value.getClass().getSimpleName(), e.getMessage());
            return String.valueOf(value);
        }
    }
}
