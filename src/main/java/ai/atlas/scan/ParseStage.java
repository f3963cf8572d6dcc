package ai.atlas.scan;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.atlas.model.ParsedFile;

/**
 * Import-only parse of many files on a fixed worker pool. Each task is
 * independent; a failing file is recorded with its error and never aborts
 * the batch.
 */
public final class ParseStage {

    private static final Logger log = LoggerFactory.getLogger(ParseStage.class);

    private final SourceParser parser;
    private final int workers;
    private final int progressInterval;

    public ParseStage(SourceParser parser, int workers, int progressInterval) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.workers = Math.max(1, workers);
        this.progressInterval = Math.max(1, progressInterval);
    }

    /**
     * @param relativePaths '/'-separated paths under {@code projectRoot}
     * @return results keyed by relative path, sorted
     */
    public Map<String, ParsedFile> run(Path projectRoot, List<String> relativePaths, ProgressListener listener)
            throws InterruptedException {
        Objects.requireNonNull(projectRoot, "projectRoot");
        final ProgressListener progress = listener == null ? ProgressListener.NONE : listener;
        final Map<String, ParsedFile> results = new TreeMap<>();
        if (relativePaths.isEmpty()) {
            return results;
        }

        final int total = relativePaths.size();
        final ExecutorService pool = Executors.newFixedThreadPool(Math.min(workers, total), new WorkerFactory());
        try {
            final CompletionService<ParsedFile> completion = new ExecutorCompletionService<>(pool);
            final Map<Future<ParsedFile>, String> pending = new HashMap<>();
            for (String rel : relativePaths) {
                pending.put(completion.submit(() -> parseOne(projectRoot, rel)), rel);
            }

            int completed = 0;
            for (int i = 0; i < total; i++) {
                final Future<ParsedFile> done = completion.take();
                final String rel = pending.get(done);
                ParsedFile parsed;
                try {
                    parsed = done.get();
                } catch (ExecutionException ex) {
                    log.error("Parse worker failed for {}", rel, ex.getCause());
                    parsed = new ParsedFile(rel, List.of(), String.valueOf(ex.getCause()));
                }
                results.put(rel, parsed);

                completed++;
                if (completed % progressInterval == 0) {
                    progress.onProgress(completed, total, "Parsing imports " + completed + "/" + total);
                }
            }
        } finally {
            pool.shutdownNow();
        }

        final long failures = results.values().stream().filter(ParsedFile::failed).count();
        if (failures > 0) {
            log.warn("{} of {} files could not be parsed", failures, total);
        }
        return results;
    }

    private ParsedFile parseOne(Path projectRoot, String rel) {
        final ParseResult r = parser.parse(projectRoot.resolve(rel), false);
        if (r.failed()) {
            return new ParsedFile(rel, List.of(), r.error());
        }
        return new ParsedFile(rel, new ArrayList<>(r.imports()), null);
    }

    private static final class WorkerFactory implements java.util.concurrent.ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            final Thread t = new Thread(r, "parse-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
