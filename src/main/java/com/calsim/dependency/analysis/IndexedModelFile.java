package com.calsim.dependency.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.calsim.dependency.model.DependencyRecord;
import com.calsim.dependency.model.ModelFile;
import com.calsim.dependency.parser.LineMapper;
import com.calsim.dependency.parser.StatementKind;
import com.calsim.dependency.parser.StatementMatch;
import com.calsim.dependency.parser.StatementMatcher;
import com.calsim.dependency.parser.WreslSanitizer;

import lombok.Getter;

/**
 * A model file with its statement search text, line map and statement list
 * computed once.
 *
 * Statements are located in {@code statementText} (comments and case blocks
 * blanked, same length as the raw content), so a match span is also a span of
 * the raw content.
 */
@Getter
public class IndexedModelFile {

    private final ModelFile file;
    private final String statementText;
    private final LineMapper lineMapper;
    private final List<StatementMatch> statements;

    public IndexedModelFile(ModelFile file) {
        this.file = file;
        this.statementText = WreslSanitizer.forStatementSearch(file.getContent());
        this.lineMapper = new LineMapper(file.getContent());

        // defines first, then goals
        List<StatementMatch> all = new ArrayList<>();
        all.addAll(StatementMatcher.findAll(statementText, StatementKind.DEFINE));
        all.addAll(StatementMatcher.findAll(statementText, StatementKind.GOAL));
        this.statements = Collections.unmodifiableList(all);
    }

    public List<StatementMatch> findDefinitions(String variable) {
        return StatementMatcher.find(statementText, StatementKind.DEFINE, variable);
    }

    /**
     * Raw statement text, comments and case blocks included.
     */
    public String statementSource(int start, int end) {
        return file.getContent().substring(start, end);
    }

    /**
     * Statement body reduced to candidate variable references: comments and
     * non-variable tokens blanked, case contents kept.
     */
    public String bodyReferences(int start, int end) {
        return WreslSanitizer.forInputExtraction(StatementMatcher.body(statementSource(start, end)));
    }

    public DependencyRecord toRecord(String variable, StatementMatch match) {
        return new DependencyRecord(variable, file.getPath(), lineMapper.map(match), match.getStart(), match.getEnd());
    }

    public String getPath() {
        return file.getPath();
    }
}
