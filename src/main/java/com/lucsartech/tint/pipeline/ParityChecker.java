package com.lucsartech.tint.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Compares the outputs of two runs file by file.
 */
public final class ParityChecker {

    private static final Logger log = LoggerFactory.getLogger(ParityChecker.class);

    private ParityChecker() {}

    public record ParityResult(
            int compared,
            List<String> mismatched,
            List<String> onlyInFirst,
            List<String> onlyInSecond
    ) {
        public ParityResult {
            mismatched = List.copyOf(mismatched);
            onlyInFirst = List.copyOf(onlyInFirst);
            onlyInSecond = List.copyOf(onlyInSecond);
        }

        public boolean identical() {
            return mismatched.isEmpty() && onlyInFirst.isEmpty() && onlyInSecond.isEmpty();
        }
    }

    /**
     * Byte-compare every file name present in either directory.
     */
    public static ParityResult compare(Path first, Path second) throws IOException {
        Set<String> firstNames = fileNames(first);
        Set<String> secondNames = fileNames(second);

        var mismatched = new ArrayList<String>();
        var onlyInFirst = new ArrayList<String>();
        int compared = 0;

        for (String name : firstNames) {
            if (!secondNames.contains(name)) {
                onlyInFirst.add(name);
                continue;
            }
            compared++;
            if (Files.mismatch(first.resolve(name), second.resolve(name)) != -1L) {
                mismatched.add(name);
                log.warn("Output differs between runs: {}", name);
            }
        }

        var onlyInSecond = secondNames.stream()
                .filter(name -> !firstNames.contains(name))
                .toList();

        var result = new ParityResult(compared, mismatched, onlyInFirst, onlyInSecond);
        log.info("Parity check: {} compared, {} mismatched, {} / {} unmatched",
                compared, mismatched.size(), onlyInFirst.size(), onlyInSecond.size());
        return result;
    }

    private static Set<String> fileNames(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return new TreeSet<>();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile)
                    .map(path -> path.getFileName().toString())
                    .collect(Collectors.toCollection(TreeSet::new));
        }
    }
}
