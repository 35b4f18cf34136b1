package com.verilog.tools.preproc;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the file named by an {@code `include} directive.
 *
 * Search order: the name as an absolute path, then the directory of the including file,
 * then each include directory in the order it was added. The first existing file wins.
 */
public class IncludeResolver {
    private static final Logger log = LoggerFactory.getLogger(IncludeResolver.class);

    private final List<Path> includePaths;

    public IncludeResolver(List<Path> includePaths) {
        this.includePaths = new ArrayList<>(includePaths != null ? includePaths : List.of());
    }

    public void addIncludePath(Path dir) {
        includePaths.add(dir);
    }

    public List<Path> getIncludePaths() {
        return List.copyOf(includePaths);
    }

    /**
     * Resolve {@code name} as written in the directive.
     *
     * @param includingDir directory of the including file, null for in-memory text
     */
    public Optional<Path> resolve(String name, Path includingDir) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }

        Path requested;
        try {
            requested = Path.of(name);
        } catch (InvalidPathException e) {
            log.debug("Include name '{}' is not a valid path", name);
            return Optional.empty();
        }

        if (requested.isAbsolute()) {
            return existing(requested);
        }

        if (includingDir != null) {
            Optional<Path> found = existing(includingDir.resolve(requested));
            if (found.isPresent()) {
                return found;
            }
        }

        for (Path dir : includePaths) {
            if (dir == null || !Files.isDirectory(dir)) {
                continue;
            }
            Optional<Path> found = existing(dir.resolve(requested));
            if (found.isPresent()) {
                return found;
            }
        }

        return Optional.empty();
    }

    private static Optional<Path> existing(Path candidate) {
        return Files.isRegularFile(candidate)
                ? Optional.of(candidate.toAbsolutePath().normalize())
                : Optional.empty();
    }
}
