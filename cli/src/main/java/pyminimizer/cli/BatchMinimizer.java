package pyminimizer.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import pyminimizer.lang.Minimizer;
import pyminimizer.lang.MinimizerException;
import pyminimizer.lang.MinimizerOptions;

/**
 * Runs the minimizer over a single file or a directory tree. A file that fails is logged and
 * reported in the {@link BatchResult}; the remaining files are still processed.
 */
@RequiredArgsConstructor
public final class BatchMinimizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchMinimizer.class);

    static final String PYTHON_EXTENSION = ".py";

    private final @NonNull MinimizerOptions options;
    private final int jobs;
    private final @NonNull PrintWriter out;

    /**
     * Minimizes one file to {@code target}, or to the output writer when {@code target} is null.
     */
    public BatchResult minimizeFile(@NonNull Path source, Path target) {
        var outcome = minimize(source, target);
        if (outcome.text() != null) {
            out.println(outcome.text());
            out.flush();
        }
        return new BatchResult(List.of(outcome));
    }

    /**
     * Minimizes every Python file below {@code sourceDir}. With a {@code targetDir} the tree is
     * mirrored there and other files are copied unchanged; without one each minimized file is
     * printed after a header line naming it.
     */
    public BatchResult minimizeTree(@NonNull Path sourceDir, Path targetDir)
            throws IOException, InterruptedException {
        List<Path> files;
        try (Stream<Path> walk = Files.walk(sourceDir)) {
            files = walk.filter(Files::isRegularFile)
                .filter(file -> targetDir != null || isPython(file))
                .sorted()
                .collect(Collectors.toList());
        }
        LOGGER.info("Found {} files below {}", files.size(), sourceDir);

        var executor = newExecutor();
        try {
            var futures = new ArrayList<Future<FileOutcome>>(files.size());
            for (var file : files) {
                var target = targetDir != null ? targetDir.resolve(sourceDir.relativize(file).toString()) : null;
                futures.add(executor.submit(() -> process(file, target)));
            }

            var outcomes = new ArrayList<FileOutcome>(files.size());
            for (var i = 0; i < futures.size(); i++) {
                var outcome = await(files.get(i), futures.get(i));
                if (outcome.text() != null) {
                    out.println(outcome.source() + ":");
                    out.println(outcome.text());
                    out.flush();
                }
                outcomes.add(outcome);
            }
            return new BatchResult(outcomes);
        } finally {
            executor.shutdownNow();
        }
    }

    private static FileOutcome await(Path file, Future<FileOutcome> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException ex) {
            LOGGER.error("Failed to minimize {}", file, ex.getCause());
            return FileOutcome.failed(file, String.valueOf(ex.getCause()));
        }
    }

    private FileOutcome process(Path source, Path target) {
        if (target != null && !isPython(source)) {
            return copy(source, target);
        }
        return minimize(source, target);
    }

    private FileOutcome copy(Path source, Path target) {
        try {
            createParent(target);
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            LOGGER.debug("Copied {} to {}", source, target);
            return FileOutcome.copied(source, target);
        } catch (IOException ex) {
            LOGGER.error("Failed to copy {}: {}", source, ex.toString());
            return FileOutcome.failed(source, ex.toString());
        }
    }

    private FileOutcome minimize(Path source, Path target) {
        try {
            var events = new LoggingEventSink(source);
            var minimized = new Minimizer(options, events).minimize(Files.readString(source));
            events.logSummary();
            if (target == null) {
                return FileOutcome.minimized(source, null, minimized);
            }
            createParent(target);
            Files.writeString(target, minimized);
            LOGGER.info("Minimized {} to {}", source, target);
            return FileOutcome.minimized(source, target, null);
        } catch (MinimizerException ex) {
            LOGGER.error("Failed to minimize {}: {}", source, ex.getMessage());
            return FileOutcome.failed(source, ex.getMessage());
        } catch (IOException | UncheckedIOException ex) {
            LOGGER.error("Failed to minimize {}: {}", source, ex.toString());
            return FileOutcome.failed(source, ex.toString());
        }
    }

    private static void createParent(Path target) throws IOException {
        var parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    static boolean isPython(Path file) {
        var name = file.getFileName();
        return name != null && name.toString().toLowerCase(Locale.ROOT).endsWith(PYTHON_EXTENSION);
    }

    private ExecutorService newExecutor() {
        return Executors.newFixedThreadPool(Math.max(1, jobs), new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                var thread = new Thread(r, "pyminimizer-worker-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        });
    }
}
