package work.lcod.pumslabel.dictionary;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits raw dictionary text into normalized {@link DictionaryLine}s.
 *
 * <p>Lines wider than the dictionary's fixed record width are cut at that width
 * before anything else happens, so long labels come out truncated.
 */
public final class LineTokenizer {
    public static final int DEFAULT_LINE_WIDTH = 244;

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");
    private static final Pattern DOT_BOUNDARY = Pattern.compile("(?= \\.)");

    private final int lineWidth;

    public LineTokenizer() {
        this(DEFAULT_LINE_WIDTH);
    }

    public LineTokenizer(int lineWidth) {
        if (lineWidth <= 0) {
            throw new IllegalArgumentException("line width must be positive: " + lineWidth);
        }
        this.lineWidth = lineWidth;
    }

    public int lineWidth() {
        return lineWidth;
    }

    public List<DictionaryLine> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        var source = text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
        var lines = new ArrayList<DictionaryLine>();
        int number = 1;
        for (String raw : source.lines().toList()) {
            lines.add(tokenizeLine(number++, raw));
        }
        return lines;
    }

    DictionaryLine tokenizeLine(int number, String raw) {
        String clipped = raw.length() > lineWidth ? raw.substring(0, lineWidth) : raw;
        String normalized = WHITESPACE.matcher(clipped).replaceAll(" ").strip();
        if (normalized.isEmpty()) {
            return new DictionaryLine(number, raw, "", List.of(), List.of());
        }
        return new DictionaryLine(number, raw, normalized, List.of(normalized.split(" ")), splitOnDots(normalized));
    }

    private static List<String> splitOnDots(String normalized) {
        var tokens = new ArrayList<String>();
        for (String part : DOT_BOUNDARY.split(normalized)) {
            tokens.add(part.strip());
        }
        return tokens;
    }
}
