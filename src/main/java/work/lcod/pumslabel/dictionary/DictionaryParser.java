package work.lcod.pumslabel.dictionary;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the dictionary engine: text in, label script lines out.
 *
 * <p>The parser never touches a dataset and performs no I/O. Executing the
 * statements is left to a {@code LabelApplier}.
 */
public final class DictionaryParser {
    private static final Logger logger = LoggerFactory.getLogger(DictionaryParser.class);

    private final LineTokenizer tokenizer;
    private final VariableAssembler assembler = new VariableAssembler();
    private final StatementEmitter emitter = new StatementEmitter();

    public DictionaryParser() {
        this(new LineTokenizer());
    }

    public DictionaryParser(LineTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    /**
     * Parses a data dictionary into ordered statement lines, spacer lines included.
     *
     * @param year dictionary year, selects the header layout
     * @param samplePeriod 1- or 5-year sample, only used for logging
     * @throws DictionaryFormatException when no variable header is recognized
     */
    public List<String> parseDictionary(String text, int year, int samplePeriod) {
        var variables = parseVariables(text, year);
        var lines = emitter.emit(variables);
        logger.info("Parsed {} variables into {} label lines from the {} {}-year dictionary",
            variables.size(), lines.size(), year, samplePeriod);
        return lines;
    }

    /**
     * Runs the tokenize, classify and assemble stages only.
     */
    public List<Variable> parseVariables(String text, int year) {
        var grammar = HeaderGrammar.forYear(year);
        var lines = tokenizer.tokenize(text);
        var classified = new RowClassifier(grammar).classify(lines);
        if (classified.stream().noneMatch(ClassifiedLine::isVariableHeader)) {
            throw new DictionaryFormatException(year, grammar, lines.size());
        }
        logger.debug("Classified {} lines with the {} header layout", classified.size(), grammar);
        return assembler.assemble(classified);
    }
}
