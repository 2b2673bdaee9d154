package work.lcod.pumslabel.dictionary;

/**
 * Kinds of label directives, declared in the order they appear inside a variable block.
 */
public enum StatementKind {
    VARIABLE_LABEL,
    VALUE_LABEL_DEFINE,
    VALUE_LABEL_APPLY,
    NOTE
}
