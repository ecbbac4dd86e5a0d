package io.github.mandar2812.cdl;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import io.github.mandar2812.cdl.lex.Lexer;
import io.github.mandar2812.cdl.lex.Token;
import io.github.mandar2812.cdl.lex.TokenType;

/**
 * Recursive-descent recognizer for the netCDF-3 CDL grammar.
 *
 * <p>Tokens are pulled from a lexer one at a time with a single token
 * of lookahead, and each declaration is passed to a
 * {@link DatasetBuilder} as soon as it has been recognised.
 * The grammar is:
 * <pre>
 *    dataset      := NETCDF '{' dims_section vars_section data_section '}'
 *    dims_section := DIMENSIONS (dim_decl (',' dim_decl)* ';')+ | empty
 *    dim_decl     := IDENT '=' (INT_CONST | DOUBLE_CONST | UNLIMITED)
 *    vars_section := VARIABLES ((var_decl | attr_decl | gattr_decl) ';')*
 *                  | (gattr_decl ';')* | empty
 *    var_decl     := type var_spec (',' var_spec)*
 *    var_spec     := IDENT ('(' IDENT (',' IDENT)* ')')?
 *    attr_decl    := IDENT ':' IDENT '=' const (',' const)*
 *    gattr_decl   := ':' IDENT '=' const (',' const)*
 *    data_section := DATA (IDENT '=' dconst (',' dconst)* ';')* | empty
 *    const        := BYTE | SHORT | INT | FLOAT | DOUBLE | TERMSTRING
 *    dconst       := const | '_'
 * </pre>
 *
 * <p>Any token out of place is fatal: it is logged and a
 * {@link CdlSyntaxException} is thrown.  There is no error recovery.
 * Content errors raised by the builder are reported against the line
 * on which the offending declaration or data statement starts.
 *
 * @since    16 Oct 2026
 */
class GrammarParser {

    private final Lexer lexer_;
    private final DatasetBuilder builder_;
    private Token lookahead_;
    private boolean hasLookahead_;
    private int stmtLine_;

    private static final Logger logger_ =
        Logger.getLogger( GrammarParser.class.getName() );

    /**
     * Constructor.
     *
     * @param  lexer  token source
     * @param  builder  receives declarations as they are recognised
     */
    GrammarParser( Lexer lexer, DatasetBuilder builder ) {
        lexer_ = lexer;
        builder_ = builder;
        stmtLine_ = -1;
    }

    /**
     * Reads a complete dataset description from the lexer.
     * The builder's dataset is begun but not ended by this method.
     *
     * @throws  CdlException  if the text is ungrammatical or describes
     *                        invalid content
     * @throws  IOException   if the backend fails
     */
    public void parseDataset() throws IOException {
        try {
            parseDatasetBody();
        }
        catch ( CdlContentException e ) {
            throw withLine( e, stmtLine_ );
        }
    }

    private void parseDatasetBody() throws IOException {
        Token nameTok = expect( TokenType.NETCDF );
        builder_.beginDataset( (String) nameTok.getValue() );
        expect( TokenType.LBRACE );
        if ( peekType() == TokenType.DIMENSIONS ) {
            next();
            parseDimensions();
        }
        parseVariables();
        if ( peekType() == TokenType.DATA ) {
            next();
            parseData();
        }
        expect( TokenType.RBRACE );
        Token extra = next();
        if ( extra != null ) {
            throw syntaxError( extra, "after end of dataset" );
        }
    }

    private void parseDimensions() throws IOException {
        do {
            parseDimensionDecl();
            while ( peekType() == TokenType.COMMA ) {
                next();
                parseDimensionDecl();
            }
            expect( TokenType.SEMICOLON );
        } while ( peekType() == TokenType.IDENT );
    }

    private void parseDimensionDecl() throws IOException {
        String name = (String) startStatement( TokenType.IDENT ).getValue();
        expect( TokenType.EQUALS );
        Token lengTok = next();
        TokenType ltype = lengTok == null ? null : lengTok.getType();
        if ( ltype == TokenType.UNLIMITED_K ) {
            builder_.declareUnlimitedDimension( name );
        }
        else if ( ltype == TokenType.INT_CONST ||
                  ltype == TokenType.DOUBLE_CONST ) {

            // Lengths given as double constants are truncated.
            double dleng = ((Number) lengTok.getValue()).doubleValue();
            builder_.declareDimension( name, (long) dleng );
        }
        else {
            throw syntaxError( lengTok, "in length of dimension " + name );
        }
    }

    private void parseVariables() throws IOException {
        if ( peekType() == TokenType.VARIABLES ) {
            next();
            for ( TokenType type; ( type = peekType() ) != null; ) {
                if ( type.isTypeKeyword() ) {
                    parseVariableDecl();
                }
                else if ( type == TokenType.IDENT ) {
                    parseAttributeDecl();
                }
                else if ( type == TokenType.COLON ) {
                    parseGlobalAttributeDecl();
                }
                else {
                    break;
                }
                expect( TokenType.SEMICOLON );
            }
        }
        else {
            while ( peekType() == TokenType.COLON ) {
                parseGlobalAttributeDecl();
                expect( TokenType.SEMICOLON );
            }
        }
    }

    private void parseVariableDecl() throws IOException {
        Token typeTok = next();
        builder_.setPendingType( DataType.forKeyword( typeTok.getLexeme() ) );
        parseVariableSpec();
        while ( peekType() == TokenType.COMMA ) {
            next();
            parseVariableSpec();
        }
    }

    private void parseVariableSpec() throws IOException {
        String name = (String) startStatement( TokenType.IDENT ).getValue();
        List<String> dimNames = new ArrayList<String>();
        if ( peekType() == TokenType.LPAREN ) {
            next();
            dimNames.add( (String) expect( TokenType.IDENT ).getValue() );
            while ( peekType() == TokenType.COMMA ) {
                next();
                dimNames.add( (String) expect( TokenType.IDENT ).getValue() );
            }
            expect( TokenType.RPAREN );
        }
        builder_.declareVariable( name,
                                  dimNames.toArray( new String[ 0 ] ) );
    }

    private void parseAttributeDecl() throws IOException {
        String varName =
            (String) startStatement( TokenType.IDENT ).getValue();
        expect( TokenType.COLON );
        String attName = (String) expect( TokenType.IDENT ).getValue();
        expect( TokenType.EQUALS );
        builder_.setVariableAttribute( varName, attName,
                                       parseConstants( false ) );
    }

    private void parseGlobalAttributeDecl() throws IOException {
        startStatement( TokenType.COLON );
        String attName = (String) expect( TokenType.IDENT ).getValue();
        expect( TokenType.EQUALS );
        builder_.setGlobalAttribute( attName, parseConstants( false ) );
    }

    private void parseData() throws IOException {
        while ( peekType() == TokenType.IDENT ) {
            String varName =
                (String) startStatement( TokenType.IDENT ).getValue();
            expect( TokenType.EQUALS );
            List<Object> values = parseConstants( true );
            expect( TokenType.SEMICOLON );
            builder_.writeData( varName, values );
        }
    }

    /**
     * Reads a non-empty comma-separated list of constants.
     *
     * @param  allowFill  whether the fill marker is permitted
     * @return  constant values
     */
    private List<Object> parseConstants( boolean allowFill )
            throws CdlException {
        List<Object> values = new ArrayList<Object>();
        values.add( parseConstant( allowFill ) );
        while ( peekType() == TokenType.COMMA ) {
            next();
            values.add( parseConstant( allowFill ) );
        }
        return values;
    }

    private Object parseConstant( boolean allowFill ) throws CdlException {
        Token tok = next();
        if ( tok != null &&
             ( tok.getType().isConstant() ||
               ( allowFill && tok.getType() == TokenType.FILLVALUE ) ) ) {
            return tok.getValue();
        }
        else {
            throw syntaxError( tok, "where constant expected" );
        }
    }

    /**
     * Consumes the next token, which must be of a given type.
     *
     * @param  type  required token type
     * @return  consumed token
     */
    private Token expect( TokenType type ) throws CdlException {
        Token tok = next();
        if ( tok == null || tok.getType() != type ) {
            throw syntaxError( tok, "where " + type + " expected" );
        }
        return tok;
    }

    /**
     * Consumes the first token of a declaration or data statement,
     * and notes its line for error reporting.
     *
     * @param  type  required token type
     * @return  consumed token
     */
    private Token startStatement( TokenType type ) throws CdlException {
        Token tok = expect( type );
        stmtLine_ = tok.getLine();
        return tok;
    }

    private TokenType peekType() throws CdlException {
        if ( ! hasLookahead_ ) {
            lookahead_ = lexer_.nextToken();
            hasLookahead_ = true;
        }
        return lookahead_ == null ? null : lookahead_.getType();
    }

    private Token next() throws CdlException {
        peekType();
        hasLookahead_ = false;
        Token tok = lookahead_;
        if ( tok != null ) {
            logger_.finest( "Token " + tok + " at line " + tok.getLine() );
        }
        return tok;
    }

    /**
     * Returns a content error which carries a source line.
     *
     * @param  err  exception as thrown
     * @param  line  line of the statement being processed, or -1
     * @return  err if it already has a line, otherwise an equivalent
     *          exception with the given line
     */
    private static CdlContentException withLine( CdlContentException err,
                                                 int line ) {
        if ( err.getLine() > 0 || line <= 0 ) {
            return err;
        }
        CdlContentException lineErr =
            new CdlContentException( err.getMessage(), line );
        lineErr.initCause( err );
        return lineErr;
    }

    /**
     * Logs and returns an exception describing an unexpected token.
     *
     * @param  tok  offending token, or null for end of input
     * @param  context  description of where it was found
     * @return  exception to throw
     */
    private CdlSyntaxException syntaxError( Token tok, String context ) {
        final String msg;
        final int line;
        if ( tok == null ) {
            msg = "Syntax error: unexpected end of input " + context;
            line = lexer_.getLine();
        }
        else {
            msg = "Syntax error at token " + tok.getType() + ", value "
                + tok.getValue() + " " + context;
            line = tok.getLine();
        }
        logger_.severe( msg + " (line " + line + ")" );
        return new CdlSyntaxException( msg, line );
    }
}
