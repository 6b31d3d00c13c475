package com.mmrag;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.mmrag.answer.Answer;
import com.mmrag.cache.ResultCache;
import com.mmrag.error.CapabilityUnavailableException;
import com.mmrag.error.NoDataException;
import com.mmrag.error.ValidationException;
import com.mmrag.ingest.BatchIngestionReport;
import com.mmrag.query.QueryIntent;
import com.mmrag.retrieval.RetrievalRequest;
import com.mmrag.retrieval.RetrievalResult;
import com.mmrag.retrieval.RetrievalStrategy;
import com.mmrag.runtime.AppConfig;
import com.mmrag.service.MultimodalRagService;
import com.mmrag.service.StoreStats;
import com.mmrag.store.InMemoryVectorStore;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "mmrag",
        mixinStandardHelpOptions = true,
        version = "mmrag 0.1.0",
        description = "Ingest text, image and PDF documents and query them with multi-strategy retrieval.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_NO_DATA = 3;
    static final int EXIT_CAPABILITY_UNAVAILABLE = 4;
    static final int EXIT_PARTIAL_INGESTION = 5;
    static final int EXIT_INGESTION_FAILED = 6;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "stats",
            converter = ModeConverter.class)
    Mode mode;

    @Option(names = "--store-path", description = "Path for the vector store snapshot (overrides config)")
    Path storePath;

    @Option(names = "--cache-path", description = "Path for the result cache snapshot (overrides config)")
    Path cachePath;

    @Option(names = { "-f", "--file" }, description = "Document to ingest; repeat for a batch")
    List<Path> files = new ArrayList<>();

    @Option(names = "--parallel", description = "Ingest a batch with the bounded worker pool", defaultValue = "false")
    boolean parallel;

    @Option(names = { "-q", "--query" }, description = "Query text for retrieve, classify and answer modes")
    String query;

    @Option(names = "--strategy", description = "Retrieval strategy: semantic, hybrid or expanded (default: from query intent)")
    String strategy;

    @Option(names = "--top-k", description = "Number of results (default: retrieval.defaultResults)")
    Integer topK;

    @Option(names = "--rerank", description = "Rerank retrieved results", defaultValue = "false")
    boolean rerank;

    @Option(names = "--filter", description = "Metadata filter as key=value; repeatable")
    Map<String, String> filter = new LinkedHashMap<>();

    @Option(names = "--document-id", description = "Document id for delete mode")
    String documentId;

    PrintStream out = System.out;

    private final ObjectWriter jsonWriter = new ObjectMapper().writerWithDefaultPrettyPrinter();

    enum Mode {
        ingest,
        retrieve,
        classify,
        answer,
        stats,
        clear_cache,
        delete
    }

    static class ModeConverter implements CommandLine.ITypeConverter<Mode> {
        @Override
        public Mode convert(String value) {
            return Mode.valueOf(value.strip().toLowerCase(Locale.ROOT).replace('-', '_'));
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = AppConfig.load(configPath);
        Path resolvedStorePath = storePath != null ? storePath : Path.of(config.getStore().getPath());
        Path resolvedCachePath = cachePath != null ? cachePath : Path.of(config.getCache().getSnapshotPath());
        log.info("Starting mmrag in {} mode", mode);
        log.debug("Using config file={} store={} cache={}", configPath, resolvedStorePath, resolvedCachePath);

        InMemoryVectorStore store = InMemoryVectorStore.load(resolvedStorePath);
        ResultCache cache = new ResultCache(
                config.getCache().isEnabled(),
                Duration.ofSeconds(config.getCache().getTtlSeconds()));
        cache.load(resolvedCachePath);

        try (MultimodalRagService service = createService(config, store, cache)) {
            int exitCode = run(service, config);
            if (mode == Mode.ingest || mode == Mode.delete) {
                store.save(resolvedStorePath);
            }
            cache.save(resolvedCachePath);
            return exitCode;
        } catch (ValidationException e) {
            log.error("Invalid request: {}", e.getMessage());
            return EXIT_USAGE;
        } catch (NoDataException e) {
            log.error(e.getMessage());
            return EXIT_NO_DATA;
        } catch (CapabilityUnavailableException e) {
            log.error("Capability failure capability={} reason={}", e.capability(), e.getMessage());
            return EXIT_CAPABILITY_UNAVAILABLE;
        }
    }

    MultimodalRagService createService(AppConfig config, InMemoryVectorStore store, ResultCache cache) {
        return MultimodalRagService.create(config, store, cache, new OkHttpClient());
    }

    private int run(MultimodalRagService service, AppConfig config) throws IOException {
        switch (mode) {
            case ingest -> {
                if (files.isEmpty()) {
                    log.error("--file is required in ingest mode");
                    return EXIT_USAGE;
                }
                BatchIngestionReport report = service.ingestFiles(files, parallel);
                print(report);
                log.info("Ingested documents succeeded={} failed={} chunks={}",
                        report.successes(), report.failures(), report.chunksCreated());
                if (report.allFailed()) {
                    return EXIT_INGESTION_FAILED;
                }
                return report.partialFailure() ? EXIT_PARTIAL_INGESTION : EXIT_OK;
            }
            case retrieve -> {
                requireQuery();
                RetrievalStrategy requested = strategy == null ? null : RetrievalStrategy.parse(strategy);
                int nResults = topK != null ? topK : config.getRetrieval().getDefaultResults();
                RetrievalResult result = service.retrieve(
                        new RetrievalRequest(query, nResults, requested, new LinkedHashMap<>(filter), rerank));
                print(result);
                return EXIT_OK;
            }
            case classify -> {
                requireQuery();
                QueryIntent intent = service.classify(query);
                Map<String, Object> classification = new LinkedHashMap<>();
                classification.put("query", query);
                classification.put("intent", intent.label());
                classification.put("strategy", intent.defaultStrategy().label());
                print(classification);
                return EXIT_OK;
            }
            case answer -> {
                requireQuery();
                int nResults = topK != null ? topK : config.getRetrieval().getDefaultResults();
                Answer answer = service.answer(query, nResults);
                print(answer);
                return EXIT_OK;
            }
            case stats -> {
                StoreStats stats = service.stats();
                print(stats);
                return EXIT_OK;
            }
            case clear_cache -> {
                service.clearCache();
                log.info("Cleared result cache");
                return EXIT_OK;
            }
            case delete -> {
                if (documentId == null || documentId.isBlank()) {
                    log.error("--document-id is required in delete mode");
                    return EXIT_USAGE;
                }
                int removed = service.deleteDocument(documentId);
                Map<String, Object> deletion = new LinkedHashMap<>();
                deletion.put("document_id", documentId);
                deletion.put("chunks_removed", removed);
                print(deletion);
                return EXIT_OK;
            }
            default -> throw new IllegalStateException("Unhandled mode " + mode);
        }
    }

    private void requireQuery() {
        if (query == null || query.isBlank()) {
            throw new ValidationException("--query is required in " + mode + " mode");
        }
    }

    private void print(Object value) throws IOException {
        out.println(jsonWriter.writeValueAsString(value));
    }
}
