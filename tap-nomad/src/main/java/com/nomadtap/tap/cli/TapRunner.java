package com.nomadtap.tap.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nomadtap.tap.config.TapNomadProperties;
import com.nomadtap.tap.error.CatalogException;
import com.nomadtap.tap.error.StateCorruptionException;
import com.nomadtap.tap.error.TapException;
import com.nomadtap.tap.model.ReplicationState;
import com.nomadtap.tap.model.StreamDefinition;
import com.nomadtap.tap.model.StreamSelection;
import com.nomadtap.tap.model.SyncResult;
import com.nomadtap.tap.output.MessageWriter;
import com.nomadtap.tap.schema.SchemaRegistry;
import com.nomadtap.tap.service.CatalogService;
import com.nomadtap.tap.service.StateService;
import com.nomadtap.tap.service.SyncCancellation;
import com.nomadtap.tap.service.SyncOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Command-line entry point.
 *
 * <pre>
 *   --about               tap metadata as JSON
 *   --discover            catalog of every stream
 *   --catalog=FILE        streams to sync (default: all)
 *   --state=FILE          state from the previous run (default: none)
 * </pre>
 *
 * Exit status: 0 when every selected stream was attempted, 1 on a fatal error, 2 when
 * {@code tap-nomad.sync.fail-on-stream-error} is set and a stream failed.
 *
 * On shutdown the context stops this bean before destroying any other, so an in-flight sync gets
 * the grace period to finish its current stream and write the final STATE while the output is
 * still open.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TapRunner implements ApplicationRunner, ExitCodeGenerator, SmartLifecycle {

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_STREAM_FAILED = 2;

    private final CatalogService catalogService;
    private final StateService stateService;
    private final SyncOrchestrator orchestrator;
    private final SyncCancellation cancellation;
    private final SchemaRegistry registry;
    private final MessageWriter writer;
    private final ObjectMapper objectMapper;
    private final TapNomadProperties properties;

    private int exitCode = EXIT_OK;
    private volatile boolean running;
    private volatile CountDownLatch activeSync;

    @Override
    public void run(ApplicationArguments args) {
        try {
            if (args.containsOption("about")) {
                writer.writeDocument(about());
            } else if (args.containsOption("discover")) {
                writer.writeDocument(catalogService.discover());
            } else {
                exitCode = sync(optionValue(args, "catalog"), optionValue(args, "state"));
            }
        } catch (TapException e) {
            log.error("Run aborted: {}", e.getMessage(), e);
            exitCode = EXIT_FATAL;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int sync(String catalogFile, String stateFile) {
        Map<String, StreamSelection> userCatalog = catalogFile == null ? null : catalogService.parse(readCatalog(catalogFile));
        ReplicationState state = stateFile == null ? ReplicationState.empty() : stateService.parse(readState(stateFile));

        CountDownLatch finished = new CountDownLatch(1);
        activeSync = finished;
        try {
            SyncResult result = orchestrator.sync(userCatalog, state);
            if (result.summary().hasFailures() && properties.getSync().isFailOnStreamError()) {
                return EXIT_STREAM_FAILED;
            }
            return EXIT_OK;
        } finally {
            finished.countDown();
        }
    }

    @Override
    public void start() {
        running = true;
    }

    @Override
    public void stop() {
        CountDownLatch finished = activeSync;
        if (finished != null && finished.getCount() > 0) {
            cancellation.cancel();
            awaitCurrentStream(finished);
        }
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private ObjectNode about() {
        ObjectNode about = objectMapper.createObjectNode();
        about.put("name", "tap-nomad");
        about.put("version", properties.getVersion());
        about.put("description", "Extracts Nomad cluster scheduler state as a Singer message stream");
        about.set("capabilities", objectMapper.valueToTree(List.of("about", "catalog", "discover", "state")));
        about.set("streams", objectMapper.valueToTree(registry.definitions().stream().map(StreamDefinition::name).toList()));
        return about;
    }

    private void awaitCurrentStream(CountDownLatch finished) {
        try {
            long graceMs = properties.getSync().getShutdownGracePeriod().toMillis();
            if (!finished.await(graceMs, TimeUnit.MILLISECONDS)) {
                log.warn("Stream still running after {} ms grace period; exiting anyway", graceMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private String readCatalog(String file) {
        try {
            return Files.readString(Path.of(file));
        } catch (IOException e) {
            throw new CatalogException("Cannot read catalog file " + file, e);
        }
    }

    private String readState(String file) {
        try {
            return Files.readString(Path.of(file));
        } catch (IOException e) {
            throw new StateCorruptionException("Cannot read state file " + file, e);
        }
    }

    private static String optionValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }
}
