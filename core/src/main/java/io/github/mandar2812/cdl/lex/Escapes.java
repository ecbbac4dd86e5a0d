package io.github.mandar2812.cdl.lex;

/**
 * Decodes backslash escape sequences in CDL strings, character
 * literals and names.
 *
 * @since    15 Oct 2026
 */
public class Escapes {

    /**
     * Private constructor prevents instantiation.
     */
    private Escapes() {
    }

    /**
     * Expands the escape sequences in the body of a quoted string.
     * The usual C single-character escapes, octal <code>\NNN</code>
     * and hex <code>\xHH</code> are recognised.  A backslash followed
     * by any other character yields that character.
     *
     * @param  body  string text without the enclosing quotes
     * @return  decoded string
     */
    public static String decodeString( String body ) {
        if ( body.indexOf( '\\' ) < 0 ) {
            return body;
        }
        StringBuilder sbuf = new StringBuilder( body.length() );
        int n = body.length();
        for ( int i = 0; i < n; i++ ) {
            char c = body.charAt( i );
            if ( c != '\\' || i + 1 >= n ) {
                sbuf.append( c );
                continue;
            }
            char e = body.charAt( ++i );
            int simple = simpleEscape( e );
            if ( simple >= 0 ) {
                sbuf.append( (char) simple );
            }
            else if ( isOctalDigit( e ) ) {
                int j = i;
                int code = 0;
                while ( j < n && j < i + 3 && isOctalDigit( body.charAt( j ) ) ) {
                    code = code * 8 + ( body.charAt( j ) - '0' );
                    j++;
                }
                sbuf.append( (char) ( code & 0xff ) );
                i = j - 1;
            }
            else if ( ( e == 'x' || e == 'X' ) && i + 1 < n &&
                      Character.digit( body.charAt( i + 1 ), 16 ) >= 0 ) {
                int j = i + 1;
                int code = 0;
                while ( j < n && j < i + 3 &&
                        Character.digit( body.charAt( j ), 16 ) >= 0 ) {
                    code = code * 16 + Character.digit( body.charAt( j ), 16 );
                    j++;
                }
                sbuf.append( (char) code );
                i = j - 1;
            }
            else {
                sbuf.append( e );
            }
        }
        return sbuf.toString();
    }

    /**
     * Decodes the body of a quoted character literal such as
     * <code>a</code>, <code>\n</code>, <code>\101</code> or
     * <code>\x41</code>.
     *
     * @param  body  literal text without the enclosing single quotes
     * @return  character code, or -1 if the body is not a legal
     *          character literal
     */
    public static int decodeCharLiteral( String body ) {
        int n = body.length();
        if ( n == 1 && body.charAt( 0 ) != '\\' ) {
            return body.charAt( 0 );
        }
        if ( n < 2 || body.charAt( 0 ) != '\\' ) {
            return -1;
        }
        char e = body.charAt( 1 );
        if ( n == 2 ) {
            return isOctalDigit( e ) ? e - '0' : simpleEscape( e );
        }
        if ( isOctalDigit( e ) ) {
            int code = 0;
            for ( int i = 1; i < n; i++ ) {
                char c = body.charAt( i );
                if ( ! isOctalDigit( c ) || i > 3 ) {
                    return -1;
                }
                code = code * 8 + ( c - '0' );
            }
            return code;
        }
        if ( ( e == 'x' || e == 'X' ) && n <= 4 ) {
            int code = 0;
            for ( int i = 2; i < n; i++ ) {
                int d = Character.digit( body.charAt( i ), 16 );
                if ( d < 0 ) {
                    return -1;
                }
                code = code * 16 + d;
            }
            return code;
        }
        return -1;
    }

    /**
     * Removes escaping backslashes from a CDL name,
     * so that for instance <code>\5foo</code> becomes <code>5foo</code>.
     *
     * @param  name  name as it appears in the source
     * @return  name with escapes removed
     */
    public static String deescapeName( String name ) {
        if ( name.indexOf( '\\' ) < 0 ) {
            return name;
        }
        StringBuilder sbuf = new StringBuilder( name.length() );
        int n = name.length();
        for ( int i = 0; i < n; i++ ) {
            char c = name.charAt( i );
            if ( c == '\\' && i + 1 < n ) {
                c = name.charAt( ++i );
            }
            sbuf.append( c );
        }
        return sbuf.toString();
    }

    /**
     * Returns the character denoted by a single-character escape.
     *
     * @param  e  character following the backslash
     * @return  character code, or -1 if <code>e</code> is not a
     *          single-character escape
     */
    private static int simpleEscape( char e ) {
        switch ( e ) {
            case 'n':  return '\n';
            case 't':  return '\t';
            case 'r':  return '\r';
            case 'f':  return '\f';
            case 'b':  return '\b';
            case 'a':  return 0x07;
            case 'v':  return 0x0b;
            case '\\': return '\\';
            case '\'': return '\'';
            case '"':  return '"';
            case '?':  return '?';
            default:   return -1;
        }
    }

    private static boolean isOctalDigit( char c ) {
        return c >= '0' && c <= '7';
    }
}
