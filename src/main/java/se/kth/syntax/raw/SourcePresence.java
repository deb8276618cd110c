package se.kth.syntax.raw;

/**
 * Whether a node was actually present in the source text. Missing nodes keep their kind (and, for
 * tokens, their canonical text) but print as nothing.
 */
public enum SourcePresence {
    PRESENT,
    MISSING
}
