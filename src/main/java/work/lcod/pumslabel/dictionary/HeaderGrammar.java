package work.lcod.pumslabel.dictionary;

/**
 * The two variable-header layouts used by the PUMS data dictionaries.
 *
 * <p>Both require the header to follow a blank line. Up to 2016 a header reads
 * {@code NAME WIDTH}; from 2017 on the type sits in between ({@code NAME Numeric WIDTH}).
 */
public enum HeaderGrammar {
    BEFORE_2017(2),
    SINCE_2017(3);

    public static final int FIRST_YEAR_WITH_TYPED_HEADERS = 2017;

    private final int wordCount;

    HeaderGrammar(int wordCount) {
        this.wordCount = wordCount;
    }

    public static HeaderGrammar forYear(int year) {
        return year < FIRST_YEAR_WITH_TYPED_HEADERS ? BEFORE_2017 : SINCE_2017;
    }

    public int wordCount() {
        return wordCount;
    }

    /**
     * Returns whether {@code line} opens a new variable. {@code previous} is null at the start of the text.
     */
    public boolean isHeader(DictionaryLine line, DictionaryLine previous) {
        boolean afterBlank = previous == null || previous.isBlank();
        return afterBlank
            && line.wordCount() == wordCount
            && line.dotToken(wordCount).isEmpty();
    }
}
