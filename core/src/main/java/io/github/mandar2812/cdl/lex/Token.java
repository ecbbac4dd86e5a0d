package io.github.mandar2812.cdl.lex;

/**
 * A lexical token read from CDL text.
 *
 * @since    14 Oct 2026
 */
public class Token {

    private final TokenType type_;
    private final String lexeme_;
    private final Object value_;
    private final int line_;

    /**
     * Constructor.
     *
     * @param  type  token kind
     * @param  lexeme  source text of the token, or its canonical form
     *                 for keywords
     * @param  value   decoded literal value; for constants a Byte, Short,
     *                 Integer, Float, Double or String,
     *                 for names and keywords the name as a String
     * @param  line    1-based source line
     */
    public Token( TokenType type, String lexeme, Object value, int line ) {
        type_ = type;
        lexeme_ = lexeme;
        value_ = value;
        line_ = line;
    }

    /**
     * Returns the kind of this token.
     *
     * @return  token type
     */
    public TokenType getType() {
        return type_;
    }

    /**
     * Returns the text of this token.
     *
     * @return  lexeme
     */
    public String getLexeme() {
        return lexeme_;
    }

    /**
     * Returns the decoded value of this token.
     *
     * @return  value
     */
    public Object getValue() {
        return value_;
    }

    /**
     * Returns the line on which this token started.
     *
     * @return  1-based line number
     */
    public int getLine() {
        return line_;
    }

    @Override
    public String toString() {
        return type_ + "(" + value_ + ")";
    }
}
