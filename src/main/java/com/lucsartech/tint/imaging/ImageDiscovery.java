package com.lucsartech.tint.imaging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Non-recursive enumeration of the image files in a directory.
 */
public final class ImageDiscovery {

    private static final Logger log = LoggerFactory.getLogger(ImageDiscovery.class);

    private final Set<String> extensions;
    private final boolean createMissing;

    public ImageDiscovery(Collection<String> extensions, boolean createMissing) {
        if (extensions == null || extensions.isEmpty()) {
            throw new IllegalArgumentException("At least one file extension is required");
        }
        this.extensions = extensions.stream()
                .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.createMissing = createMissing;
    }

    /**
     * List regular files in {@code directory} whose extension matches, sorted by file name.
     *
     * @throws DiscoveryException if the directory cannot be listed
     */
    public List<Path> discover(Path directory) throws DiscoveryException {
        if (Files.notExists(directory)) {
            if (!createMissing) {
                throw new DiscoveryException("Input directory does not exist: " + directory.toAbsolutePath());
            }
            try {
                Files.createDirectories(directory);
                log.info("Created empty input directory {}", directory.toAbsolutePath());
            } catch (IOException e) {
                throw new DiscoveryException("Cannot create input directory " + directory.toAbsolutePath(), e);
            }
        }

        if (!Files.isDirectory(directory)) {
            throw new DiscoveryException("Input path is not a directory: " + directory.toAbsolutePath());
        }

        var found = new ArrayList<Path>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, this::matches)) {
            stream.forEach(found::add);
        } catch (IOException | RuntimeException e) {
            throw new DiscoveryException("Cannot list input directory " + directory.toAbsolutePath(), e);
        }

        found.sort(Comparator.comparing(path -> path.getFileName().toString()));
        log.debug("Discovered {} files in {} matching {}", found.size(), directory, extensions);
        return List.copyOf(found);
    }

    public Set<String> extensions() {
        return extensions;
    }

    private boolean matches(Path path) {
        if (!Files.isRegularFile(path)) {
            return false;
        }
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && extensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
