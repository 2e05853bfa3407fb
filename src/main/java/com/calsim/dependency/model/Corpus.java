package com.calsim.dependency.model;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Read-only set of model files loaded for one analysis run, keyed by relative path.
 * Enumeration follows insertion order.
 */
@Value
@Builder(toBuilder = true)
public class Corpus {

    /**
     * Root directory the relative paths are resolved against.
     */
    Path studyDir;

    @NonNull
    @Singular("file")
    Map<String, ModelFile> files;

    public Collection<ModelFile> all() {
        return files.values();
    }

    public int size() {
        return files.size();
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    public static Corpus of(ModelFile... modelFiles) {
        CorpusBuilder builder = Corpus.builder();
        for (ModelFile f : modelFiles) {
            builder.file(f.getPath(), f);
        }
        return builder.build();
    }
}
