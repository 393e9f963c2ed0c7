package org.pragmatica.nixfmt.parser;

import org.pragmatica.nixfmt.error.ParseError;
import org.pragmatica.nixfmt.tree.NodeKind;
import org.pragmatica.nixfmt.tree.SourceLocation;
import org.pragmatica.nixfmt.tree.SyntaxElement;
import org.pragmatica.nixfmt.tree.SyntaxNode;
import org.pragmatica.nixfmt.tree.SyntaxToken;
import org.pragmatica.nixfmt.tree.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Recursive-descent parser for the Nix subset, producing a lossless syntax tree.
 *
 * <p>Trivia between two elements is attached to the node that receives the
 * following element, so no node starts or ends with whitespace or comments.
 * Binary operators are parsed by precedence climbing, lowest first:
 * {@code ->}, {@code ||}, {@code &&}, {@code == !=}, {@code < <= > >=},
 * {@code //}, {@code !}, {@code + -}, {@code * /}, {@code ++}, {@code ?},
 * unary {@code -}, application, selection.
 */
public final class NixParser {
    private static final int PREFIX_NOT_OPERAND = 8;

    private final List<SyntaxToken> tokens;
    private final SourceLocation end;
    private int pos;

    private NixParser(List<SyntaxToken> tokens, SourceLocation end) {
        this.tokens = tokens;
        this.end = end;
        this.pos = 0;
    }

    /**
     * Parse source text into a tree rooted at a {@link NodeKind#ROOT} node.
     */
    public static ParseResult parse(String text) {
        var tokens = NixLexer.tokenize(text);
        // unclassified input never reaches the grammar
        for (var token : tokens) {
            if (token.kind() == TokenKind.ERROR) {
                return new ParseResult.Failure(lexerError(token));
            }
        }
        try{
            var parser = new NixParser(tokens, SourceLocation.START.advance(text));
            return new ParseResult.Success(parser.parseRoot());
        } catch (SyntaxFailure failure) {
            return new ParseResult.Failure(failure.error);
        }
    }

    private static ParseError lexerError(SyntaxToken token) {
        var text = token.text();
        var location = token.span()
                            .start();
        if (text.startsWith("\"") || text.startsWith("''")) {
            return new ParseError.UnterminatedLiteral(location, "string");
        }
        if (text.startsWith("/*")) {
            return new ParseError.UnterminatedLiteral(location, "comment");
        }
        return new ParseError.UnexpectedInput(location, text, "token");
    }

    private SyntaxNode parseRoot() {
        var children = new ArrayList<SyntaxElement>();
        add(children, this::parseExpression);
        trivia(children);
        if (pos < tokens.size()) {
            throw fail("end of input");
        }
        return SyntaxNode.node(NodeKind.ROOT, children);
    }

    private SyntaxNode parseExpression() {
        var kind = lookahead(0);
        if (kind.isEmpty()) {
            throw fail("expression");
        }
        return switch (kind.get()) {
            case LET -> parseLetIn();
            case WITH -> parseScoped(NodeKind.WITH, TokenKind.WITH);
            case ASSERT -> parseScoped(NodeKind.ASSERT, TokenKind.ASSERT);
            case IF -> parseIfElse();
            case IDENT -> isAhead(1, TokenKind.COLON) || isAhead(1, TokenKind.AT)
                          ? parseLambda()
                          : parseBinary(1);
            case L_BRACE -> isPatternAhead()
                            ? parseLambda()
                            : parseBinary(1);
            default -> parseBinary(1);
        };
    }

    private SyntaxNode parseLetIn() {
        var children = new ArrayList<SyntaxElement>();
        expect(children, TokenKind.LET);
        parseBindings(children, TokenKind.IN);
        expect(children, TokenKind.IN);
        add(children, this::parseExpression);
        return SyntaxNode.node(NodeKind.LET_IN, children);
    }

    /**
     * {@code with e; body} and {@code assert e; body}.
     */
    private SyntaxNode parseScoped(NodeKind kind, TokenKind keyword) {
        var children = new ArrayList<SyntaxElement>();
        expect(children, keyword);
        add(children, this::parseExpression);
        expect(children, TokenKind.SEMICOLON);
        add(children, this::parseExpression);
        return SyntaxNode.node(kind, children);
    }

    private SyntaxNode parseIfElse() {
        var children = new ArrayList<SyntaxElement>();
        expect(children, TokenKind.IF);
        add(children, this::parseExpression);
        expect(children, TokenKind.THEN);
        add(children, this::parseExpression);
        expect(children, TokenKind.ELSE);
        add(children, this::parseExpression);
        return SyntaxNode.node(NodeKind.IF_ELSE, children);
    }

    private SyntaxNode parseLambda() {
        var children = new ArrayList<SyntaxElement>();
        if (isAhead(0, TokenKind.IDENT) && isAhead(1, TokenKind.COLON)) {
            add(children, this::parseIdent);
        }else {
            add(children, this::parsePattern);
        }
        expect(children, TokenKind.COLON);
        add(children, this::parseExpression);
        return SyntaxNode.node(NodeKind.LAMBDA, children);
    }

    private SyntaxNode parsePattern() {
        var children = new ArrayList<SyntaxElement>();
        boolean boundBefore = isAhead(0, TokenKind.IDENT);
        if (boundBefore) {
            add(children, this::parseIdent);
            expect(children, TokenKind.AT);
        }
        expect(children, TokenKind.L_BRACE);
        while (!isAhead(0, TokenKind.R_BRACE)) {
            if (isAhead(0, TokenKind.ELLIPSIS)) {
                expect(children, TokenKind.ELLIPSIS);
            }else {
                add(children, this::parsePatternEntry);
            }
            if (!isAhead(0, TokenKind.COMMA)) {
                break;
            }
            expect(children, TokenKind.COMMA);
        }
        expect(children, TokenKind.R_BRACE);
        if (!boundBefore && isAhead(0, TokenKind.AT)) {
            expect(children, TokenKind.AT);
            add(children, this::parseIdent);
        }
        return SyntaxNode.node(NodeKind.PATTERN, children);
    }

    private SyntaxNode parsePatternEntry() {
        var children = new ArrayList<SyntaxElement>();
        add(children, this::parseIdent);
        if (isAhead(0, TokenKind.QUESTION)) {
            expect(children, TokenKind.QUESTION);
            add(children, this::parseExpression);
        }
        return SyntaxNode.node(NodeKind.PAT_ENTRY, children);
    }

    private SyntaxNode parseBinary(int minPrecedence) {
        var lhs = parsePrefix();
        while (true) {
            var operator = lookahead(0);
            int precedence = operator.map(NixParser::infixPrecedence)
                                     .orElse(0);
            if (precedence == 0 || precedence < minPrecedence) {
                return lhs;
            }
            var children = new ArrayList<SyntaxElement>();
            children.add(lhs);
            expect(children, operator.get());
            if (operator.get() == TokenKind.QUESTION) {
                add(children, this::parseKey);
            }else {
                int next = isRightAssociative(operator.get())
                           ? precedence
                           : precedence + 1;
                add(children, () -> parseBinary(next));
            }
            lhs = SyntaxNode.node(NodeKind.OPERATION, children);
        }
    }

    private SyntaxNode parsePrefix() {
        if (isAhead(0, TokenKind.INVERT)) {
            var children = new ArrayList<SyntaxElement>();
            expect(children, TokenKind.INVERT);
            add(children, () -> parseBinary(PREFIX_NOT_OPERAND));
            return SyntaxNode.node(NodeKind.UNARY_OP, children);
        }
        if (isAhead(0, TokenKind.SUB)) {
            var children = new ArrayList<SyntaxElement>();
            expect(children, TokenKind.SUB);
            add(children, this::parseApplication);
            return SyntaxNode.node(NodeKind.UNARY_OP, children);
        }
        return parseApplication();
    }

    private SyntaxNode parseApplication() {
        var function = parseSelect();
        while (lookahead(0).filter(NixParser::startsOperand)
                           .isPresent()) {
            var children = new ArrayList<SyntaxElement>();
            children.add(function);
            add(children, this::parseSelect);
            function = SyntaxNode.node(NodeKind.APPLY, children);
        }
        return function;
    }

    private SyntaxNode parseSelect() {
        var base = parsePrimary();
        if (!isAhead(0, TokenKind.DOT)) {
            return base;
        }
        var children = new ArrayList<SyntaxElement>();
        children.add(base);
        while (isAhead(0, TokenKind.DOT)) {
            expect(children, TokenKind.DOT);
            add(children, this::parseAttribute);
        }
        if (isOrKeywordAhead()) {
            expect(children, TokenKind.IDENT);
            add(children, this::parseSelect);
        }
        return SyntaxNode.node(NodeKind.INDEX_SET, children);
    }

    private SyntaxNode parsePrimary() {
        var kind = lookahead(0);
        if (kind.isEmpty()) {
            throw fail("expression");
        }
        return switch (kind.get()) {
            case INTEGER, FLOAT, PATH, URI -> leaf(NodeKind.VALUE);
            case STRING -> leaf(NodeKind.STRING);
            case IDENT -> leaf(NodeKind.IDENT);
            case L_PAREN -> parseParen();
            case L_BRACK -> parseList();
            case L_BRACE, REC -> parseSet();
            default -> throw fail("expression");
        };
    }

    private SyntaxNode parseParen() {
        var children = new ArrayList<SyntaxElement>();
        expect(children, TokenKind.L_PAREN);
        add(children, this::parseExpression);
        expect(children, TokenKind.R_PAREN);
        return SyntaxNode.node(NodeKind.PAREN, children);
    }

    private SyntaxNode parseList() {
        var children = new ArrayList<SyntaxElement>();
        expect(children, TokenKind.L_BRACK);
        while (!isAhead(0, TokenKind.R_BRACK)) {
            add(children, this::parseSelect);
        }
        expect(children, TokenKind.R_BRACK);
        return SyntaxNode.node(NodeKind.LIST, children);
    }

    private SyntaxNode parseSet() {
        var children = new ArrayList<SyntaxElement>();
        if (isAhead(0, TokenKind.REC)) {
            expect(children, TokenKind.REC);
        }
        expect(children, TokenKind.L_BRACE);
        parseBindings(children, TokenKind.R_BRACE);
        expect(children, TokenKind.R_BRACE);
        return SyntaxNode.node(NodeKind.SET, children);
    }

    private void parseBindings(List<SyntaxElement> children, TokenKind terminator) {
        while (!isAhead(0, terminator)) {
            if (isAhead(0, TokenKind.INHERIT)) {
                add(children, this::parseInherit);
            }else {
                add(children, this::parseEntry);
            }
        }
    }

    private SyntaxNode parseEntry() {
        var children = new ArrayList<SyntaxElement>();
        add(children, this::parseKey);
        expect(children, TokenKind.ASSIGN);
        add(children, this::parseExpression);
        expect(children, TokenKind.SEMICOLON);
        return SyntaxNode.node(NodeKind.SET_ENTRY, children);
    }

    private SyntaxNode parseInherit() {
        var children = new ArrayList<SyntaxElement>();
        expect(children, TokenKind.INHERIT);
        if (isAhead(0, TokenKind.L_PAREN)) {
            add(children, this::parseParen);
        }
        while (!isAhead(0, TokenKind.SEMICOLON)) {
            add(children, this::parseAttribute);
        }
        expect(children, TokenKind.SEMICOLON);
        return SyntaxNode.node(NodeKind.INHERIT, children);
    }

    private SyntaxNode parseKey() {
        var children = new ArrayList<SyntaxElement>();
        add(children, this::parseAttribute);
        while (isAhead(0, TokenKind.DOT)) {
            expect(children, TokenKind.DOT);
            add(children, this::parseAttribute);
        }
        return SyntaxNode.node(NodeKind.KEY, children);
    }

    private SyntaxNode parseAttribute() {
        if (isAhead(0, TokenKind.IDENT)) {
            return leaf(NodeKind.IDENT);
        }
        if (isAhead(0, TokenKind.STRING)) {
            return leaf(NodeKind.STRING);
        }
        throw fail("attribute name");
    }

    private SyntaxNode parseIdent() {
        if (!isAhead(0, TokenKind.IDENT)) {
            throw fail("identifier");
        }
        return leaf(NodeKind.IDENT);
    }

    private SyntaxNode leaf(NodeKind kind) {
        return SyntaxNode.node(kind, List.of(tokens.get(pos++ )));
    }

    /**
     * Moves pending trivia into {@code children}, then the node built by {@code parser}.
     */
    private void add(List<SyntaxElement> children, Supplier<SyntaxNode> parser) {
        trivia(children);
        children.add(parser.get());
    }

    /**
     * Moves pending trivia into {@code children}, then the next token, which must be of the given kind.
     */
    private void expect(List<SyntaxElement> children, TokenKind kind) {
        trivia(children);
        if (pos >= tokens.size() || tokens.get(pos)
                                          .kind() != kind) {
            throw fail(describe(kind));
        }
        children.add(tokens.get(pos++ ));
    }

    private void trivia(List<SyntaxElement> children) {
        while (pos < tokens.size() && tokens.get(pos)
                                            .kind()
                                            .isTrivia()) {
            children.add(tokens.get(pos++ ));
        }
    }

    /**
     * Kind of the n-th significant token from the current position.
     */
    private Optional<TokenKind> lookahead(int n) {
        int seen = 0;
        for (int i = pos; i < tokens.size(); i++ ) {
            var token = tokens.get(i);
            if (token.kind()
                     .isTrivia()) {
                continue;
            }
            if (seen == n) {
                return Optional.of(token.kind());
            }
            seen++ ;
        }
        return Optional.empty();
    }

    private boolean isAhead(int n, TokenKind kind) {
        return lookahead(n).filter(found -> found == kind)
                           .isPresent();
    }

    private boolean isOrKeywordAhead() {
        for (int i = pos; i < tokens.size(); i++ ) {
            var token = tokens.get(i);
            if (!token.kind()
                      .isTrivia()) {
                return token.kind() == TokenKind.IDENT && token.text()
                                                               .equals("or");
            }
        }
        return false;
    }

    /**
     * At a {@code {}: does a lambda pattern start here rather than a set literal?
     */
    private boolean isPatternAhead() {
        var first = lookahead(1);
        if (first.isEmpty()) {
            return false;
        }
        return switch (first.get()) {
            case ELLIPSIS -> true;
            case R_BRACE -> isAhead(2, TokenKind.COLON) || isAhead(2, TokenKind.AT);
            case IDENT -> isAhead(2, TokenKind.COMMA) || isAhead(2, TokenKind.QUESTION)
                          || (isAhead(2, TokenKind.R_BRACE) && (isAhead(3, TokenKind.COLON) || isAhead(3, TokenKind.AT)));
            default -> false;
        };
    }

    private static int infixPrecedence(TokenKind kind) {
        return switch (kind) {
            case IMPLICATION -> 1;
            case OR -> 2;
            case AND -> 3;
            case EQUAL, NOT_EQUAL -> 4;
            case LESS, LESS_OR_EQ, MORE, MORE_OR_EQ -> 5;
            case UPDATE -> 6;
            case ADD, SUB -> 8;
            case MUL, DIV -> 9;
            case CONCAT -> 10;
            case QUESTION -> 11;
            default -> 0;
        };
    }

    private static boolean isRightAssociative(TokenKind kind) {
        return kind == TokenKind.IMPLICATION || kind == TokenKind.UPDATE || kind == TokenKind.CONCAT;
    }

    private static boolean startsOperand(TokenKind kind) {
        return switch (kind) {
            case IDENT, INTEGER, FLOAT, PATH, URI, STRING, L_BRACE, L_BRACK, L_PAREN, REC -> true;
            default -> false;
        };
    }

    private static String describe(TokenKind kind) {
        return switch (kind) {
            case L_BRACE -> "'{'";
            case R_BRACE -> "'}'";
            case L_BRACK -> "'['";
            case R_BRACK -> "']'";
            case L_PAREN -> "'('";
            case R_PAREN -> "')'";
            case ASSIGN -> "'='";
            case SEMICOLON -> "';'";
            case COLON -> "':'";
            case AT -> "'@'";
            case IDENT -> "identifier";
            default -> "'" + kind.name()
                                 .toLowerCase() + "'";
        };
    }

    private SyntaxFailure fail(String expected) {
        for (int i = pos; i < tokens.size(); i++ ) {
            var token = tokens.get(i);
            if (!token.kind()
                      .isTrivia()) {
                return new SyntaxFailure(new ParseError.UnexpectedInput(token.span()
                                                                             .start(),
                                                                        token.text(),
                                                                        expected));
            }
        }
        return new SyntaxFailure(new ParseError.UnexpectedEof(end, expected));
    }

    /**
     * Unwinds the descent on the first syntax error.
     */
    private static final class SyntaxFailure extends RuntimeException {
        private final transient ParseError error;

        SyntaxFailure(ParseError error) {
            super(error.message(), null, false, false);
            this.error = error;
        }
    }
}
