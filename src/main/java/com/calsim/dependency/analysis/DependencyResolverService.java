package com.calsim.dependency.analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calsim.dependency.model.Corpus;
import com.calsim.dependency.model.DependencyAnalysis;
import com.calsim.dependency.model.DependencyRecord;
import com.calsim.dependency.parser.StatementMatch;
import com.calsim.dependency.parser.StatementMatcher;
import com.calsim.dependency.parser.WreslSanitizer;

import lombok.NoArgsConstructor;

/**
 * Computes where a variable is defined, which defined variables feed into it and
 * which statements use it.
 *
 * Three passes over the corpus:
 * <ol>
 *   <li>definitions: {@code define <variable> { ... }} statements</li>
 *   <li>inputs: words left in the definition bodies, each looked up as a definition</li>
 *   <li>dependents: every define/goal statement whose body mentions the variable</li>
 * </ol>
 */
@NoArgsConstructor
public class DependencyResolverService {
    private static final Logger log = LoggerFactory.getLogger(DependencyResolverService.class);

    public DependencyAnalysis analyze(Corpus corpus, String variable) {
        Objects.requireNonNull(corpus, "corpus");
        Objects.requireNonNull(variable, "variable");
        return analyze(new CorpusIndex(corpus), variable);
    }

    public DependencyAnalysis analyze(CorpusIndex index, String variable) {
        List<DependencyRecord> defined = findDefinitions(index, variable);
        if (defined.isEmpty()) {
            log.info("Variable {} not found in {} model files", variable, index.files().size());
            return DependencyAnalysis.notFound(variable);
        }
        log.debug("Found {} definition(s) of {}", defined.size(), variable);

        List<DependencyRecord> inputs = findInputs(index, defined);
        log.debug("Resolved {} input location(s) for {}", inputs.size(), variable);

        List<DependencyRecord> dependents = findDependents(index, variable);
        log.debug("Found {} dependent statement(s) of {}", dependents.size(), variable);

        return DependencyAnalysis.builder()
                .variable(variable)
                .found(true)
                .defined(defined)
                .inputs(inputs)
                .dependencies(dependents)
                .build();
    }

    /**
     * Pass 1: every {@code define} statement named exactly {@code variable}, case blocks ignored.
     */
    public List<DependencyRecord> findDefinitions(CorpusIndex index, String variable) {
        List<DependencyRecord> records = new ArrayList<>();
        for (IndexedModelFile file : index.files()) {
            for (StatementMatch match : file.findDefinitions(variable)) {
                records.add(file.toRecord(variable, match));
            }
        }
        return records;
    }

    /**
     * Pass 2: candidate names from the bodies of the given definitions, each resolved
     * to its own definitions. Candidates without a definition are dropped.
     */
    public List<DependencyRecord> findInputs(CorpusIndex index, List<DependencyRecord> definitions) {
        Map<String, String> candidates = new LinkedHashMap<>();
        for (DependencyRecord definition : definitions) {
            IndexedModelFile owner = fileOf(index, definition.getFile());
            String body = owner.bodyReferences(definition.getSpanStart(), definition.getSpanEnd());
            for (String word : WreslSanitizer.words(body)) {
                candidates.putIfAbsent(word.toUpperCase(Locale.ROOT), word);
            }
        }
        log.debug("Input candidates: {}", candidates.values());

        List<DependencyRecord> inputs = new ArrayList<>();
        for (String candidate : candidates.values()) {
            inputs.addAll(findDefinitions(index, candidate));
        }
        return inputs;
    }

    /**
     * Pass 3: every define/goal statement in the corpus whose body references
     * {@code variable} as a whole word, recorded under the statement's own name.
     */
    public List<DependencyRecord> findDependents(CorpusIndex index, String variable) {
        Pattern reference = Pattern.compile("\\b" + Pattern.quote(variable) + "\\b", Pattern.CASE_INSENSITIVE);

        List<DependencyRecord> dependents = new ArrayList<>();
        for (IndexedModelFile file : index.files()) {
            for (StatementMatch match : file.getStatements()) {
                String body = file.bodyReferences(match.getStart(), match.getEnd());
                if (reference.matcher(body).find()) {
                    String statement = file.statementSource(match.getStart(), match.getEnd());
                    dependents.add(file.toRecord(StatementMatcher.declaredName(statement), match));
                }
            }
        }
        return dependents;
    }

    private IndexedModelFile fileOf(CorpusIndex index, String path) {
        return index.findByPath(path)
                .orElseThrow(() -> new IllegalStateException("Definition refers to a file outside the corpus: " + path));
    }
}
