package org.zlang.compiler.frontend.parselet;

/**
 * The binding strength of infix operators, from loosest to tightest.
 * <p>
 * Note that {@link #LOGICAL} binds looser than {@link #EQUALS} and {@link #LEGE}:
 * {@code 1 & 2 == 2} groups as {@code 1 & (2 == 2)}.
 */
public enum Precedence {
    /** The level an expression is parsed at when no operator is pending. */
    DEFAULT(-1),
    /** Just below assignment; the right side of an assignment is parsed here so that it is right-associative. */
    ASSIGN_BELOW(0),
    /** =, +=, -=, *=, /=, &amp;=, |= */
    ASSIGN(1),
    /** Reserved for a conditional operator; no standard parselet. */
    CONDITIONAL(2),
    /** &amp;, | */
    LOGICAL(3),
    /** ==, != */
    EQUALS(4),
    /** &lt;, &lt;=, &gt;, &gt;= */
    LEGE(5),
    /** +, - */
    ADDSUB(6),
    /** *, / */
    MULDIV(7),
    /** Operand level of the prefix operators !, +, - */
    PREFIX(8),
    /** Reserved for call-like postfix operators; no standard parselet. */
    CALL(9);

    private final int weight;

    Precedence(int weight) {
        this.weight = weight;
    }

    /**
     * @param other The precedence to compare against.
     * @return true if this level binds strictly looser than {@code other}.
     */
    public boolean isLowerThan(Precedence other) {
        return weight < other.weight;
    }
}
