package com.calsim.dependency.corpus;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calsim.dependency.model.Corpus;
import com.calsim.dependency.model.ModelFile;

import lombok.RequiredArgsConstructor;

/**
 * Reads every model file of a study into memory before analysis starts.
 */
@RequiredArgsConstructor
public class CorpusLoadingService {
    private static final Logger log = LoggerFactory.getLogger(CorpusLoadingService.class);

    private final ModelFileDiscoveryService discoveryService;

    public CorpusLoadingService() {
        this(new ModelFileDiscoveryService());
    }

    /**
     * @throws StudyNotFoundException if {@code studyDir} is not an existing directory
     */
    public Corpus load(Path studyDir) throws IOException {
        List<Path> files = discoveryService.discoverModelFiles(studyDir);

        Corpus.CorpusBuilder builder = Corpus.builder().studyDir(studyDir);
        for (Path path : files) {
            String key = relativeKey(studyDir, path);
            // malformed bytes decode to U+FFFD instead of failing the run
            String content = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
            builder.file(key, new ModelFile(key, content));
            log.debug("Loaded model file: {}", key);
        }

        Corpus corpus = builder.build();
        log.info("Loaded {} model files from {}", corpus.size(), studyDir.toAbsolutePath());
        return corpus;
    }

    private String relativeKey(Path studyDir, Path file) {
        return studyDir.relativize(file).toString().replace('\\', '/');
    }
}
