package work.lcod.pumslabel.dictionary;

import java.util.List;
import java.util.Objects;

/**
 * One physical dictionary line with its positional token fields.
 */
public record DictionaryLine(int number, String raw, String text, List<String> words, List<String> dotTokens) {
    public DictionaryLine {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(text, "text");
        words = List.copyOf(words);
        dotTokens = List.copyOf(dotTokens);
    }

    public boolean isBlank() {
        return text.isEmpty();
    }

    public int wordCount() {
        return words.size();
    }

    /** Whitespace token at {@code index}, or an empty string past the end. */
    public String word(int index) {
        return index < words.size() ? words.get(index) : "";
    }

    /** Dot token at {@code index}, or an empty string past the end. */
    public String dotToken(int index) {
        return index < dotTokens.size() ? dotTokens.get(index) : "";
    }
}
