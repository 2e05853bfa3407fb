package com.calsim.dependency.analysis;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.calsim.dependency.model.Corpus;

/**
 * Sanitized, statement-indexed view of a corpus, built once per analysis run and
 * shared by all resolution passes.
 */
public class CorpusIndex {

    private final List<IndexedModelFile> files;
    private final Map<String, IndexedModelFile> byPath = new LinkedHashMap<>();

    public CorpusIndex(Corpus corpus) {
        this.files = corpus.all().stream()
                .map(IndexedModelFile::new)
                .collect(Collectors.toUnmodifiableList());
        files.forEach(f -> byPath.put(f.getPath(), f));
    }

    public List<IndexedModelFile> files() {
        return files;
    }

    public Optional<IndexedModelFile> findByPath(String path) {
        return Optional.ofNullable(byPath.get(path));
    }

    public int statementCount() {
        return files.stream().mapToInt(f -> f.getStatements().size()).sum();
    }
}
