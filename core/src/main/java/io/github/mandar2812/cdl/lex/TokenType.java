package io.github.mandar2812.cdl.lex;

/**
 * Kinds of token produced by the CDL lexer.
 *
 * @since    14 Oct 2026
 */
public enum TokenType {

    /** Opening <code>netcdf</code> keyword; the value is the dataset name. */
    NETCDF,

    DIMENSIONS,
    VARIABLES,
    DATA,

    /** Dimension, variable or attribute name. */
    IDENT,

    /** Quoted string constant; the value is the decoded String. */
    TERMSTRING,

    BYTE_CONST,
    SHORT_CONST,
    INT_CONST,
    FLOAT_CONST,
    DOUBLE_CONST,

    /** Fill value marker <code>_</code>. */
    FILLVALUE,

    BYTE_K,
    CHAR_K,
    SHORT_K,
    INT_K,
    FLOAT_K,
    DOUBLE_K,
    UNLIMITED_K,

    EQUALS,
    LBRACE,
    RBRACE,
    LPAREN,
    RPAREN,
    COMMA,
    COLON,
    SEMICOLON;

    /**
     * Indicates whether this kind is a constant that may appear
     * in an attribute value list.
     *
     * @return  true for numeric and string constants
     */
    public boolean isConstant() {
        switch ( this ) {
            case BYTE_CONST:
            case SHORT_CONST:
            case INT_CONST:
            case FLOAT_CONST:
            case DOUBLE_CONST:
            case TERMSTRING:
                return true;
            default:
                return false;
        }
    }

    /**
     * Indicates whether this kind is a data type keyword.
     *
     * @return  true for byte, char, short, int, float, double keywords
     */
    public boolean isTypeKeyword() {
        switch ( this ) {
            case BYTE_K:
            case CHAR_K:
            case SHORT_K:
            case INT_K:
            case FLOAT_K:
            case DOUBLE_K:
                return true;
            default:
                return false;
        }
    }
}
