package org.bytecodeflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        System.exit(run(args, FlowConfig.load()));
    }

    static int run(String[] args, FlowConfig config) {
        if (args.length < 1) {
            System.err.println("Usage: java -jar bytecode-flow.jar <listing.json | dir> [arg ...]");
            return 1;
        }

        // 1) input: one listing or a directory of listings
        Path input = Paths.get(args[0]).toAbsolutePath();
        if (!Files.exists(input)) {
            log.error("Input not found: {}", input);
            return 2;
        }

        List<Path> listings = new ArrayList<>();
        if (Files.isDirectory(input)) {
            try (var stream = Files.walk(input)) {
                stream.filter(p -> p.toString().endsWith(".json"))
                        .sorted()
                        .forEach(listings::add);
            } catch (IOException e) {
                log.error("Failed to scan listings under {}: {}", input, e.getMessage());
                return 3;
            }
        } else {
            listings.add(input);
        }
        if (listings.isEmpty()) {
            log.warn("No listings found under {}", input);
            return 0;
        }

        // 2) positional arguments for the simulation, as JSON literals
        ListingReader reader = new ListingReader();
        List<SymbolicValue> positional = new ArrayList<>();
        for (int i = 1; i < args.length; i++) positional.add(reader.literal(args[i]));
        CallArguments callArgs = new CallArguments(positional, Map.of());

        // 3) analysis
        Set<Path> failed = new LinkedHashSet<>();
        new Analysis(config).run(listings, callArgs, failed);
        return failed.isEmpty() ? 0 : 4;
    }
}
