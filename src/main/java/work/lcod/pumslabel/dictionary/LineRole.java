package work.lcod.pumslabel.dictionary;

/**
 * Role of a dictionary line once classified.
 */
public enum LineRole {
    BLANK,
    VARIABLE_HEADER,
    VARIABLE_LABEL,
    VALUE_LABEL,
    NOTE,
    NOTE_CONTINUATION,
    OTHER
}
