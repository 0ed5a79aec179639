package com.largomodo.romcatalog.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Recognises ROM and disc-image files by extension.
 * <p>
 * Cue sheets and other descriptors are not data and are never matched; the track images they
 * point at are.
 */
public class RomFileMatcher {

    private static final Logger log = LoggerFactory.getLogger(RomFileMatcher.class);

    private static final Set<String> EXTENSIONS = Set.of(
            // Nintendo
            ".nes", ".fds", ".sfc", ".smc", ".fig", ".swc", ".gb", ".gbc", ".gba", ".n64", ".z64", ".v64", ".nds",
            // Sega
            ".sms", ".gg", ".md", ".gen", ".32x", ".sg",
            // Other cartridge systems
            ".pce", ".lnx", ".a26", ".a78", ".ws", ".wsc", ".ngp", ".ngc",
            // Disc images
            ".iso", ".bin", ".img"
    );

    private RomFileMatcher() {
        // Static utility class - prevent instantiation
    }

    /**
     * @param path file to check (may be null)
     * @return true if the path is a regular file with a known ROM extension
     */
    public static boolean isRom(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return false;
        }
        String filename = path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = filename.lastIndexOf('.');
        return dot >= 0 && EXTENSIONS.contains(filename.substring(dot));
    }

    /**
     * Every ROM file under {@code root}, in walk order. A single file is returned as-is when it
     * is a ROM.
     *
     * @throws IOException if the root cannot be traversed
     */
    public static List<Path> findRoms(Path root) throws IOException {
        if (Files.isRegularFile(root)) {
            return isRom(root) ? List.of(root) : List.of();
        }
        try (Stream<Path> stream = Files.walk(root)) {
            return stream.filter(path -> {
                        try {
                            return isRom(path);
                        } catch (UncheckedIOException e) {
                            log.warn("Cannot access {} - skipping", root.relativize(path));
                            return false;
                        }
                    })
                    .sorted()
                    .collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }
}
