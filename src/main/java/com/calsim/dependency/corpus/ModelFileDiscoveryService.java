package com.calsim.dependency.corpus;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import lombok.RequiredArgsConstructor;

/**
 * Recursively finds model files under a study directory by file extension.
 */
@RequiredArgsConstructor
public class ModelFileDiscoveryService {

    public static final String DEFAULT_EXTENSION = "wresl";

    private final String extension;

    public ModelFileDiscoveryService() {
        this(DEFAULT_EXTENSION);
    }

    /**
     * Model files under {@code studyDir}, sorted by path so repeated runs enumerate
     * them in the same order.
     */
    public List<Path> discoverModelFiles(Path studyDir) throws IOException {
        if (!Files.isDirectory(studyDir)) {
            throw new StudyNotFoundException(studyDir);
        }
        try (Stream<Path> stream = Files.walk(studyDir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(this::isModelFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private boolean isModelFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith("." + normalizedExtension());
    }

    private String normalizedExtension() {
        String ext = extension.trim().toLowerCase(Locale.ROOT);
        return ext.startsWith(".") ? ext.substring(1) : ext;
    }
}
