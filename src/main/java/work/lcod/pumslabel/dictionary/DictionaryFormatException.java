package work.lcod.pumslabel.dictionary;

/**
 * Raised when a dictionary text holds no line matching the header grammar of its year.
 */
public final class DictionaryFormatException extends RuntimeException {
    private final int year;
    private final HeaderGrammar grammar;

    public DictionaryFormatException(int year, HeaderGrammar grammar, int lineCount) {
        super("No variable headers found in " + lineCount + " dictionary lines for " + year
            + " (expected the " + grammar.wordCount() + "-word header layout)");
        this.year = year;
        this.grammar = grammar;
    }

    public int year() {
        return year;
    }

    public HeaderGrammar grammar() {
        return grammar;
    }
}
