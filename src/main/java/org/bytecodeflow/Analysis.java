package org.bytecodeflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs CFG construction and stack simulation over decoded listings and
 * writes one JSON result per function. A listing that fails is logged and
 * skipped; the rest of the batch still runs.
 */
public class Analysis {

    private static final Logger log = LoggerFactory.getLogger(Analysis.class);

    /** Both artifacts of one function. */
    public static class Result {
        public final String function;
        public final ControlFlowGraph cfg;
        public final Trace trace;

        public Result(String function, ControlFlowGraph cfg, Trace trace) {
            this.function = function;
            this.cfg = cfg;
            this.trace = trace;
        }
    }

    private final ListingReader reader;
    private final CfgBuilder cfgBuilder;
    private final JsonExporter exporter;
    private final Path outDir;

    public Analysis(ListingReader reader, CfgBuilder cfgBuilder, JsonExporter exporter, Path outDir) {
        this.reader = reader;
        this.cfgBuilder = cfgBuilder;
        this.exporter = exporter;
        this.outDir = outDir;
    }

    public Analysis(FlowConfig config) {
        this(new ListingReader(), new CfgBuilder(), new JsonExporter(new InstructionFormatter(config)),
                config.getOutputDir());
    }

    /** Analyzes one function; the simulator state lives only for this call. */
    public Result analyze(FunctionListing listing, CallArguments args) throws DecodeInconsistencyException {
        ControlFlowGraph cfg = cfgBuilder.build(listing.instructions);
        Trace trace = new StackSimulator(listing.signature, args, listing.stackEffects).run(listing.instructions);
        return new Result(listing.name, cfg, trace);
    }

    public int run(List<Path> files, CallArguments args, Set<Path> failedFiles) {
        int successCount = 0;
        int failCount = 0;

        Path root = outDir.toAbsolutePath().normalize();
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            log.error("cannot create output directory {}: {}", root, e.getMessage());
            failedFiles.addAll(files);
            return 0;
        }

        Set<String> written = new HashSet<>();
        for (Path file : files) {
            try {
                FunctionListing listing = reader.read(file);
                Result result = analyze(listing, args);

                Path out = root.resolve(outputName(listing.name, written));
                exporter.export(result.function, result.cfg, result.trace, out);

                log.info("[RESULT] SUCCESS   : {} ({} blocks, {} steps) -> {}",
                        listing.name, result.cfg.size(), result.trace.size(), out);
                successCount++;
            } catch (DecodeInconsistencyException e) {
                failCount++;
                failedFiles.add(file);
                log.error("[RESULT] FAIL      : {} ( decode inconsistency: {} )", file.getFileName(), e.getMessage());
            } catch (Exception e) {
                failCount++;
                failedFiles.add(file);
                log.error("[RESULT] FAIL      : {} ( {} )", file.getFileName(), e.getMessage());
            }
        }

        log.info("Summary: success={}, fail={}", successCount, failCount);
        return successCount;
    }

    /**
     * File name for a function's result: a single path segment under the
     * output directory, suffixed {@code _2}, {@code _3}, ... when an earlier
     * listing of this batch already took it.
     */
    static String outputName(String function, Set<String> taken) {
        String base = function.replaceAll("[^A-Za-z0-9_.-]", "_").replaceAll("^\\.+", "");
        if (base.isEmpty()) base = "function";

        String name = base;
        for (int n = 2; !taken.add(name); n++) name = base + "_" + n;
        if (!name.equals(base)) log.warn("output {}.json already written in this batch, using {}.json", base, name);
        return name + ".json";
    }
}
