package com.tsparser;

import com.tsparser.ast.Program;
import com.tsparser.ast.VariableStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point: lexes a source string and parses it into a syntax tree.
 * An instance is good for one parse.
 */
public class Parser {

    private static final Logger logger = LoggerFactory.getLogger(Parser.class);

    private final String source;
    private final ParseOptions options;
    private final TokenStream tokens;
    private final ParsingState state;

    public Parser(String source) {
        this(source, ParseOptions.DEFAULT);
    }

    public Parser(String source, ParseOptions options) {
        this.source = source;
        this.options = options;
        this.tokens = new TokenStream(new Lexer(source, options).tokenize());
        this.state = new ParsingState(source.length());
    }

    public Program parse() {
        Program program = Program.fromReader(tokens, state, options);
        logger.debug("Parsed {} statements from {} tokens ({} chars)",
            program.body().size(), tokens.size(), source.length());
        return program;
    }

    /**
     * Parses input that holds exactly one variable statement, optionally followed by {@code ;}.
     *
     * @throws UnexpectedTokenException if anything follows the statement
     */
    public VariableStatement parseVariableStatement() {
        VariableStatement statement = VariableStatement.fromReader(tokens, state, options);
        tokens.match(TokenType.SEMICOLON);
        if (!tokens.isAtEnd()) {
            throw new UnexpectedTokenException(tokens.peek().get(), "end of input");
        }
        logger.debug("Parsed {} with {} declarations", statement.keyword().asKeywordText().trim(),
            statement.declarations().size());
        return statement;
    }

    public ParsingState getState() {
        return state;
    }

    public TokenReader getTokens() {
        return tokens;
    }

    public static Program parse(String source) {
        return new Parser(source).parse();
    }

    public static Program parse(String source, ParseOptions options) {
        return new Parser(source, options).parse();
    }

    public static VariableStatement parseVariableStatement(String source) {
        return new Parser(source).parseVariableStatement();
    }

    public static VariableStatement parseVariableStatement(String source, ParseOptions options) {
        return new Parser(source, options).parseVariableStatement();
    }

    public static List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    public static List<Token> tokenize(String source, ParseOptions options) {
        return new Lexer(source, options).tokenize();
    }
}
