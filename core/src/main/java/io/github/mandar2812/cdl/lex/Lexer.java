package io.github.mandar2812.cdl.lex;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.github.mandar2812.cdl.CdlContentException;
import io.github.mandar2812.cdl.CdlException;
import io.github.mandar2812.cdl.CdlSyntaxException;
import io.github.mandar2812.cdl.DataType;
import io.github.mandar2812.cdl.FillMarker;

/**
 * Splits CDL text into tokens.
 *
 * <p>At each position the token rules are tried in a fixed order and
 * the first one that matches wins; this is not a longest-match scanner.
 * The order matters for numeric constants, whose patterns overlap:
 * float, double, short, byte, hex/octal integer, decimal integer.
 *
 * <p>Strings and identifiers may be arbitrarily long, so they are
 * scanned a character at a time rather than matched with a regular
 * expression, whose matcher recurses once per repeated group.
 *
 * <p>Characters that match no rule are lexical errors.
 * By default these are logged, counted and skipped one character
 * at a time; if the lexer is strict, a CdlSyntaxException is thrown
 * instead.  Numeric constants which are malformed or out of range
 * for their type always provoke a CdlContentException.
 *
 * <p>Tokens are produced on demand by {@link #nextToken}.
 * The lexer may be restarted from the beginning of the text
 * using {@link #reset}.
 *
 * @since    15 Oct 2026
 */
public class Lexer {

    private final String text_;
    private final boolean strict_;
    private final Matcher[] matchers_;
    private int pos_;
    private int line_;
    private int nerror_;

    private static final Logger logger_ =
        Logger.getLogger( Lexer.class.getName() );

    /** Characters skipped between tokens (newlines are counted separately).*/
    private static final String IGNORE_CHARS = " \r\t\f";

    /** Characters which may follow a backslash within a name. */
    private static final String NAME_ESCAPABLE = " !\"#$%&'()*,:;<=>?[\\]^`{|}~";

    /** ASCII punctuation permitted unescaped after the start of a name. */
    private static final String NAME_PUNCTUATION = "_.@+-";

    private static final String EXP = "(?:[eE][+-]?[0-9]+)";

    private static final String XDR_INT_RANGE =
        "(" + Integer.MIN_VALUE + " -> " + Integer.MAX_VALUE + ")";

    private static final BigInteger INT_MIN =
        BigInteger.valueOf( Integer.MIN_VALUE );
    private static final BigInteger INT_MAX =
        BigInteger.valueOf( Integer.MAX_VALUE );

    /**
     * Token rules, in the order in which they are tried.
     */
    private enum Rule {
        NETCDF( "(?i:netcdf)(?=[ \\t{])[^{]*" ),
        SECTION( "(?i:dimensions|variables|data):" ),
        TERMSTRING( null ),
        COMMENT( "//[^\\n]*" ),
        IDENT( null ),
        FLOAT_CONST( "[+-]?[0-9]*\\.[0-9]*" + EXP + "?[Ff]"
                   + "|[+-]?[0-9]*" + EXP + "[Ff]" ),
        DOUBLE_CONST( "[+-]?[0-9]*\\.[0-9]*" + EXP + "?[LlDd]?"
                    + "|[+-]?[0-9]*" + EXP + "[LlDd]?" ),
        SHORT_CONST( "[+-]?(?:[0-9]+|0[xX][0-9a-fA-F]+)[sS]" ),
        BYTE_CONST( "[+-]?[0-9]+[Bb]"
                  + "|'[^\\\\]'"
                  + "|'\\\\.'"
                  + "|'\\\\[0-7][0-7]?[0-7]?'"
                  + "|'\\\\[xX][0-9a-fA-F][0-9a-fA-F]?'" ),
        LONG_CONST( "0[xX]?[0-9a-fA-F]+[lL]?" ),
        NUMERIC_CONST( "[+-]?(?:[1-9][0-9]*|0)[lL]?" ),
        NEWLINE( "\\n+" ),
        PUNCTUATION( "[={}(),:;]" );

        /** Pattern, or null for a rule scanned by hand. */
        final Pattern pattern_;

        Rule( String regex ) {
            pattern_ = regex == null ? null : Pattern.compile( regex );
        }
    }

    /**
     * Constructs a permissive lexer.
     *
     * @param  text  CDL source text
     */
    public Lexer( String text ) {
        this( text, false );
    }

    /**
     * Constructor.
     *
     * @param  text  CDL source text
     * @param  strict  true to fail on unrecognised characters,
     *                 false to log and skip them
     */
    public Lexer( String text, boolean strict ) {
        text_ = text;
        strict_ = strict;
        Rule[] rules = Rule.values();
        matchers_ = new Matcher[ rules.length ];
        for ( int i = 0; i < rules.length; i++ ) {
            Pattern pattern = rules[ i ].pattern_;
            matchers_[ i ] = pattern == null ? null : pattern.matcher( text );
        }
        reset();
    }

    /**
     * Restarts tokenization from the start of the text.
     */
    public void reset() {
        pos_ = 0;
        line_ = 1;
        nerror_ = 0;
    }

    /**
     * Returns the current line number.
     *
     * @return  1-based line number at the current read position
     */
    public int getLine() {
        return line_;
    }

    /**
     * Returns the number of lexical errors skipped so far.
     *
     * @return  error count
     */
    public int getErrorCount() {
        return nerror_;
    }

    /**
     * Returns the next token.
     *
     * @return  next token, or null at end of text
     * @throws  CdlSyntaxException  for a missing dataset name,
     *                              or an illegal character if strict
     * @throws  CdlContentException  for a bad numeric constant
     */
    public Token nextToken() throws CdlException {
        int n = text_.length();
        while ( pos_ < n ) {
            char c = text_.charAt( pos_ );
            if ( IGNORE_CHARS.indexOf( c ) >= 0 ) {
                pos_++;
                continue;
            }
            Rule rule = null;
            int end = -1;
            Rule[] rules = Rule.values();
            for ( int i = 0; i < rules.length && rule == null; i++ ) {
                int e = matchEnd( i, rules[ i ], n );
                if ( e > pos_ ) {
                    rule = rules[ i ];
                    end = e;
                }
            }
            if ( rule == null ) {
                lexError( c );
                pos_++;
                continue;
            }
            String txt = text_.substring( pos_, end );
            int tokLine = line_;
            pos_ = end;
            line_ += countNewlines( txt );
            Token token = createToken( rule, txt, tokLine );
            if ( token != null ) {
                return token;
            }
        }
        return null;
    }

    /**
     * Tries a rule at the current position.
     *
     * @param  irule  index of rule
     * @param  rule   rule
     * @param  n   length of text
     * @return  end of the matched text, or -1 for no match
     */
    private int matchEnd( int irule, Rule rule, int n ) {
        switch ( rule ) {
            case TERMSTRING:
                return scanString( pos_, n );
            case IDENT:
                return scanIdentifier( pos_, n );
            default:
                Matcher matcher = matchers_[ irule ];
                matcher.region( pos_, n );
                return matcher.lookingAt() ? matcher.end() : -1;
        }
    }

    /**
     * Scans a double-quoted string.  A backslash escapes the following
     * character, whatever it is, including a newline.
     *
     * @return  index after the closing quote, or -1 if there is no
     *          string here or it is unterminated
     */
    private int scanString( int start, int n ) {
        if ( text_.charAt( start ) != '"' ) {
            return -1;
        }
        int i = start + 1;
        while ( i < n ) {
            char c = text_.charAt( i );
            if ( c == '"' ) {
                return i + 1;
            }
            i += c == '\\' ? 2 : 1;
        }
        return -1;
    }

    /**
     * Scans a name.  It starts with a letter, underscore, permitted
     * non-ASCII character, or backslash-escaped digit, and continues
     * with letters, digits, <code>_.@+-</code>, permitted non-ASCII
     * characters, or backslash-escaped punctuation.
     *
     * @return  index after the name, or -1 if there is no name here
     */
    private int scanIdentifier( int start, int n ) {
        int i = start;
        char c0 = text_.charAt( i );
        if ( isAsciiLetter( c0 ) || c0 == '_' ) {
            i++;
        }
        else if ( c0 == '\\' ) {
            if ( i + 1 < n && isDigit( text_.charAt( i + 1 ) ) ) {
                i += 2;
            }
            else {
                return -1;
            }
        }
        else {
            int cp = text_.codePointAt( i );
            if ( isNameCodePoint( cp ) ) {
                i += Character.charCount( cp );
            }
            else {
                return -1;
            }
        }
        while ( i < n ) {
            char c = text_.charAt( i );
            if ( isAsciiLetter( c ) || isDigit( c ) ||
                 NAME_PUNCTUATION.indexOf( c ) >= 0 ) {
                i++;
            }
            else if ( c == '\\' ) {
                if ( i + 1 < n &&
                     NAME_ESCAPABLE.indexOf( text_.charAt( i + 1 ) ) >= 0 ) {
                    i += 2;
                }
                else {
                    break;
                }
            }
            else {
                int cp = text_.codePointAt( i );
                if ( isNameCodePoint( cp ) ) {
                    i += Character.charCount( cp );
                }
                else {
                    break;
                }
            }
        }
        return i;
    }

    /**
     * Non-ASCII code points permitted in names,
     * following the legacy UTF-8 classes.
     */
    private static boolean isNameCodePoint( int cp ) {
        return ( cp >= 0x80 && cp <= 0x5bf ) || cp >= 0x800;
    }

    private static boolean isAsciiLetter( char c ) {
        return ( c >= 'a' && c <= 'z' ) || ( c >= 'A' && c <= 'Z' );
    }

    private static boolean isDigit( char c ) {
        return c >= '0' && c <= '9';
    }

    /**
     * Turns matched text into a token.
     *
     * @param  rule  rule that matched
     * @param  txt   matched text
     * @param  line  line at which the text started
     * @return   token, or null if the text produces no token
     */
    private Token createToken( Rule rule, String txt, int line )
            throws CdlException {
        switch ( rule ) {
            case NETCDF:
                String[] parts = txt.trim().split( "\\s+" );
                if ( parts.length < 2 ) {
                    throw new CdlSyntaxException( "A netCDF name is required",
                                                  line );
                }
                String dsName = Escapes.deescapeName( parts[ 1 ] );
                return new Token( TokenType.NETCDF, parts[ 1 ], dsName, line );
            case SECTION:
                String section = txt.substring( 0, txt.length() - 1 )
                                    .toLowerCase();
                return new Token( TokenType.valueOf( section.toUpperCase() ),
                                  section, section, line );
            case TERMSTRING:
                return new Token( TokenType.TERMSTRING, txt,
                                  Escapes.decodeString( txt.substring( 1,
                                                        txt.length() - 1 ) ),
                                  line );
            case COMMENT:
            case NEWLINE:
                return null;
            case IDENT:
                return createIdentToken( txt, line );
            case FLOAT_CONST:
                return new Token( TokenType.FLOAT_CONST, txt,
                                  parseFloat( txt, line ), line );
            case DOUBLE_CONST:
                return new Token( TokenType.DOUBLE_CONST, txt,
                                  parseDouble( txt, line ), line );
            case SHORT_CONST:
                return new Token( TokenType.SHORT_CONST, txt,
                                  parseShort( txt, line ), line );
            case BYTE_CONST:
                return new Token( TokenType.BYTE_CONST, txt,
                                  parseByte( txt, line ), line );
            case LONG_CONST:
            case NUMERIC_CONST:
                return createIntToken( txt, line );
            case PUNCTUATION:
                return new Token( punctuationType( txt.charAt( 0 ) ),
                                  txt, txt, line );
            default:
                throw new AssertionError( rule );
        }
    }

    /**
     * Creates a token for text matching the identifier pattern.
     * This may turn out to be the fill marker or a reserved word.
     */
    private static Token createIdentToken( String txt, int line ) {
        if ( FillMarker.TEXT.equals( txt ) ) {
            return new Token( TokenType.FILLVALUE, txt, FillMarker.INSTANCE,
                              line );
        }
        String lower = txt.toLowerCase();
        TokenType kwType = getKeywordType( lower );
        if ( kwType != null ) {
            return new Token( kwType, lower, lower, line );
        }
        return new Token( TokenType.IDENT, txt, Escapes.deescapeName( txt ),
                          line );
    }

    /**
     * Returns the token type for a reserved word.
     *
     * @param  word  lower case word
     * @return  keyword token type, or null if word is not reserved
     */
    private static TokenType getKeywordType( String word ) {
        switch ( word ) {
            case "byte":
                return TokenType.BYTE_K;
            case "char":
                return TokenType.CHAR_K;
            case "short":
                return TokenType.SHORT_K;
            case "int":
            case "integer":
            case "long":
                return TokenType.INT_K;
            case "float":
            case "real":
                return TokenType.FLOAT_K;
            case "double":
                return TokenType.DOUBLE_K;
            case "unlimited":
                return TokenType.UNLIMITED_K;
            default:
                return null;
        }
    }

    /**
     * Creates a token from a hex, octal or decimal integer constant.
     *
     * <p>Values outside the signed 32-bit range are not an error;
     * they become double constants.  The reference CDL generator does
     * the same and its output is matched here for compatibility,
     * so do not turn this into a range check.
     */
    private static Token createIntToken( String txt, int line )
            throws CdlContentException {
        String body = stripSuffix( txt, "lL" );
        BigInteger ival = parseInteger( body );
        if ( ival == null ) {
            throw new CdlContentException( "Bad integer constant: " + txt,
                                           line );
        }
        if ( ival.compareTo( INT_MIN ) < 0 || ival.compareTo( INT_MAX ) > 0 ) {
            logger_.config( "Integer constant " + txt + " outside "
                          + XDR_INT_RANGE + ", treated as double" );
            return new Token( TokenType.DOUBLE_CONST, txt,
                              Double.valueOf( ival.doubleValue() ), line );
        }
        else {
            return new Token( TokenType.INT_CONST, txt,
                              Integer.valueOf( ival.intValue() ), line );
        }
    }

    private static Float parseFloat( String txt, int line )
            throws CdlContentException {
        try {
            return Float.valueOf( Float.parseFloat( stripSuffix( txt,
                                                                 "fF" ) ) );
        }
        catch ( NumberFormatException e ) {
            throw new CdlContentException( "Bad float constant: " + txt,
                                           line );
        }
    }

    private static Double parseDouble( String txt, int line )
            throws CdlContentException {
        try {
            return Double.valueOf( Double.parseDouble( stripSuffix( txt,
                                                                  "dDlL" ) ) );
        }
        catch ( NumberFormatException e ) {
            throw new CdlContentException( "Bad double constant: " + txt,
                                           line );
        }
    }

    private static Short parseShort( String txt, int line )
            throws CdlContentException {
        BigInteger ival = parseInteger( stripSuffix( txt, "sS" ) );
        if ( ival == null ) {
            throw new CdlContentException( "Bad short constant: " + txt, line );
        }
        return Short.valueOf( (short) checkRange( ival, DataType.SHORT,
                                                  line ) );
    }

    private static Byte parseByte( String txt, int line )
            throws CdlContentException {
        final BigInteger bval;
        if ( txt.charAt( 0 ) == '\'' ) {
            int code = Escapes.decodeCharLiteral( txt.substring( 1,
                                                  txt.length() - 1 ) );
            bval = code >= 0 ? BigInteger.valueOf( code ) : null;
        }
        else {

            // Decimal only; a leading zero does not mean octal here.
            bval = new BigInteger( stripSuffix( txt, "bB" ) );
        }
        if ( bval == null ) {
            throw new CdlContentException( "Bad byte constant: " + txt, line );
        }
        return Byte.valueOf( (byte) checkRange( bval, DataType.BYTE, line ) );
    }

    /**
     * Range-checks an integer value against a data type.
     */
    private static long checkRange( BigInteger ival, DataType type, int line )
            throws CdlContentException {
        if ( ival.bitLength() >= 64 ) {
            throw new CdlContentException( type.getName()
                                         + " constant outside valid range: "
                                         + ival, line );
        }
        long lval = ival.longValue();
        try {
            type.checkRange( lval );
        }
        catch ( CdlContentException e ) {
            throw new CdlContentException( e.getMessage(), line );
        }
        return lval;
    }

    /**
     * Parses an optionally signed integer in C notation:
     * leading <code>0x</code> for hex, leading <code>0</code> for octal,
     * otherwise decimal.
     *
     * @param  txt  integer text without type suffix
     * @return  value, or null if the text is not a legal integer
     */
    static BigInteger parseInteger( String txt ) {
        boolean negative = false;
        String body = txt;
        if ( body.startsWith( "+" ) || body.startsWith( "-" ) ) {
            negative = body.charAt( 0 ) == '-';
            body = body.substring( 1 );
        }
        final int radix;
        if ( body.startsWith( "0x" ) || body.startsWith( "0X" ) ) {
            radix = 16;
            body = body.substring( 2 );
        }
        else if ( body.length() > 1 && body.charAt( 0 ) == '0' ) {
            radix = 8;
            body = body.substring( 1 );
        }
        else {
            radix = 10;
        }
        if ( body.length() == 0 ) {
            return null;
        }
        for ( int i = 0; i < body.length(); i++ ) {
            if ( Character.digit( body.charAt( i ), radix ) < 0 ) {
                return null;
            }
        }
        BigInteger ival = new BigInteger( body, radix );
        return negative ? ival.negate() : ival;
    }

    /**
     * Removes a trailing type suffix character if present.
     *
     * @param  txt  constant text
     * @param  suffixChars  characters which count as a suffix
     * @return  text without suffix
     */
    private static String stripSuffix( String txt, String suffixChars ) {
        int n = txt.length();
        return n > 0 && suffixChars.indexOf( txt.charAt( n - 1 ) ) >= 0
             ? txt.substring( 0, n - 1 )
             : txt;
    }

    private static TokenType punctuationType( char c ) {
        switch ( c ) {
            case '=': return TokenType.EQUALS;
            case '{': return TokenType.LBRACE;
            case '}': return TokenType.RBRACE;
            case '(': return TokenType.LPAREN;
            case ')': return TokenType.RPAREN;
            case ',': return TokenType.COMMA;
            case ':': return TokenType.COLON;
            case ';': return TokenType.SEMICOLON;
            default:
                throw new IllegalArgumentException( "Not punctuation: " + c );
        }
    }

    /**
     * Handles an unrecognised character.
     *
     * @param  c  offending character
     */
    private void lexError( char c ) throws CdlSyntaxException {
        String msg = c == '"'
                   ? "Unterminated string"
                   : "Illegal character '" + c + "'";
        if ( strict_ ) {
            throw new CdlSyntaxException( msg, line_ );
        }
        nerror_++;
        logger_.warning( msg + " at line " + line_ + " - skipped" );
    }

    private static int countNewlines( String txt ) {
        int count = 0;
        for ( int i = 0; i < txt.length(); i++ ) {
            if ( txt.charAt( i ) == '\n' ) {
                count++;
            }
        }
        return count;
    }

    /**
     * Convenience method which tokenizes a whole string permissively.
     *
     * @param  text  CDL text
     * @return  list of all tokens
     */
    public static List<Token> tokenize( String text ) throws CdlException {
        Lexer lexer = new Lexer( text );
        List<Token> list = new ArrayList<Token>();
        for ( Token tok; ( tok = lexer.nextToken() ) != null; ) {
            list.add( tok );
        }
        return list;
    }
}
