package taskworker;

import taskworker.config.IniConfigLoader;
import taskworker.config.WorkerConfig;
import taskworker.registry.TaskSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Standalone worker. Settings come from an optional INI file given as the
 * first argument, overridden by environment variables.
 * Runs until the process is stopped.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final String NOOP_TASK = "taskworker.noop";

    private App() {
    }

    public static void main(String[] args) throws IOException {
        WorkerConfig config = WorkerConfig.fromProperties(settings(args));

        TaskWorker worker = new TaskWorker();
        worker.init(config);
        worker.defineTask(NOOP_TASK, TaskSignature.any(), payload -> payload);

        Runtime.getRuntime().addShutdownHook(new Thread(worker::shutdown, "taskworker-shutdown"));

        log.info("Starting standalone task worker");
        worker.startBlocking();
    }

    static Map<String, String> settings(String[] args) throws IOException {
        Map<String, String> settings = new HashMap<>();
        if (args.length > 0) {
            Path file = Path.of(args[0]);
            settings.putAll(IniConfigLoader.load(file));
            log.info("Loaded settings from {}", file);
        }
        settings.putAll(System.getenv());
        return settings;
    }
}
