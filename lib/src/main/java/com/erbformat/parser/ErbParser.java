package com.erbformat.parser;

import com.erbformat.code.CodeFormatter;
import com.erbformat.code.ruby.RubyCodeFormatter;
import com.erbformat.parser.ast.CaseTerminator;
import com.erbformat.parser.ast.CharData;
import com.erbformat.parser.ast.ClosingTag;
import com.erbformat.parser.ast.Doctype;
import com.erbformat.parser.ast.Document;
import com.erbformat.parser.ast.ErbBlock;
import com.erbformat.parser.ast.ErbCase;
import com.erbformat.parser.ast.ErbCaseWhen;
import com.erbformat.parser.ast.ErbComment;
import com.erbformat.parser.ast.ErbContent;
import com.erbformat.parser.ast.ErbElse;
import com.erbformat.parser.ast.ErbElsif;
import com.erbformat.parser.ast.ErbEnd;
import com.erbformat.parser.ast.ErbIf;
import com.erbformat.parser.ast.ErbTag;
import com.erbformat.parser.ast.ErbUnless;
import com.erbformat.parser.ast.HtmlAttribute;
import com.erbformat.parser.ast.HtmlComment;
import com.erbformat.parser.ast.HtmlElement;
import com.erbformat.parser.ast.HtmlString;
import com.erbformat.parser.ast.IfTerminator;
import com.erbformat.parser.ast.Location;
import com.erbformat.parser.ast.NewLine;
import com.erbformat.parser.ast.Node;
import com.erbformat.parser.ast.OpeningTag;
import com.erbformat.parser.ast.Token;
import com.erbformat.parser.ast.TokenKind;
import com.erbformat.parser.ast.UnlessTerminator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Recursive-descent parser for ERB templates.
 *
 * <p>Every production returns {@link Optional#empty()} when it does not apply at the current
 * position; {@link ParseSession#optional} rewinds the cursor in that case so alternatives can be
 * tried. Once a construct has committed (an element's name was read, a control chain's head was
 * seen) failures become {@link ErbStructureException}s instead.
 */
public final class ErbParser {
    private static final Logger LOGGER = Logger.getLogger(ErbParser.class.getName());

    private static final Set<String> IF_LINKS = Set.of("elsif", "else", "end");
    private static final Set<String> UNLESS_LINKS = Set.of("else", "end");
    private static final Set<String> CASE_LINKS = Set.of("when", "else", "end");
    private static final Set<String> END_ONLY = Set.of("end");
    private static final Set<String> CHAIN_HEADS = Set.of("if", "unless", "case");

    private final ErbTokenizer tokenizer;
    private final CodeFormatter codeFormatter;

    public ErbParser() {
        this(new ErbTokenizer());
    }

    public ErbParser(ErbTokenizer tokenizer) {
        this(tokenizer, new RubyCodeFormatter());
    }

    /**
     * @param codeFormatter Reads keyword tags such as {@code <% if a then b end %>}; a head whose
     *     own fragment is balanced code is kept as a plain tag instead of opening a chain.
     */
    public ErbParser(ErbTokenizer tokenizer, CodeFormatter codeFormatter) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.codeFormatter = Objects.requireNonNull(codeFormatter, "codeFormatter");
    }

    public Document parse(String source) throws ErbParseException {
        Objects.requireNonNull(source, "source");
        List<Token> tokens = tokenizer.tokenize(source);
        return new ParseSession(tokens, codeFormatter).document();
    }

    @FunctionalInterface
    private interface Rule<T> {
        Optional<? extends T> parse() throws ErbStructureException;
    }

    @FunctionalInterface
    private interface MissingHandler {
        ErbStructureException missing(Token found);
    }

    /** Body of a chain link together with the keyword tag that ended it. */
    private static final class LinkBody {
        private final List<Node> elements;
        private final ErbTag terminator;

        private LinkBody(List<Node> elements, ErbTag terminator) {
            this.elements = elements;
            this.terminator = terminator;
        }
    }

    private static final class ParseSession {
        private final TokenCursor cursor;
        private final CodeFormatter codeFormatter;
        private final boolean trace = DebugFlags.isParserTraceEnabled();
        private Doctype firstDoctype;

        private ParseSession(List<Token> tokens, CodeFormatter codeFormatter) {
            this.cursor = new TokenCursor(tokens);
            this.codeFormatter = codeFormatter;
        }

        // Combinators.

        private <T> Optional<T> optional(Rule<T> rule) throws ErbStructureException {
            int mark = cursor.mark();
            Optional<T> result = rule.parse().map(value -> value);
            if (result.isEmpty() && cursor.mark() != mark) {
                if (trace) {
                    DebugFlags.captureDiagnostic(
                            "backtrack from " + cursor.peek().getKind() + " to token #" + mark);
                }
                cursor.reset(mark);
            }
            return result;
        }

        private <T> T require(Rule<T> rule, MissingHandler onMissing) throws ErbStructureException {
            Optional<T> result = optional(rule);
            if (result.isEmpty()) {
                throw onMissing.missing(cursor.peek());
            }
            return result.get();
        }

        private <T> List<T> repeat(Rule<T> rule) throws ErbStructureException {
            List<T> results = new ArrayList<>();
            while (true) {
                int mark = cursor.mark();
                Optional<T> result = optional(rule);
                if (result.isEmpty()) {
                    return results;
                }
                if (cursor.mark() == mark) {
                    throw new IllegalStateException("Rule matched without consuming input at token #" + mark);
                }
                results.add(result.get());
            }
        }

        @SafeVarargs
        private final Optional<Node> firstOf(Rule<Node>... rules) throws ErbStructureException {
            for (Rule<Node> rule : rules) {
                Optional<Node> result = optional(rule);
                if (result.isPresent()) {
                    return result;
                }
            }
            return Optional.empty();
        }

        private Optional<Token> consume(TokenKind kind) {
            return cursor.consume(kind);
        }

        private int newLineMarker() {
            return cursor.consumeAny(TokenKind.NEW_LINE, TokenKind.BLANK_LINE)
                    .map(token -> token.getKind() == TokenKind.BLANK_LINE ? 2 : 1)
                    .orElse(0);
        }

        // Productions.

        Document document() throws ErbStructureException {
            List<Node> elements = repeat(this::anyNode);
            if (!cursor.atEnd()) {
                Token found = cursor.peek();
                Location span = tagSpan(found);
                throw new ErbStructureException("Unexpected " + describe(found) + " at " + span, span, span);
            }
            return new Document(elements);
        }

        private Optional<Node> anyNode() throws ErbStructureException {
            return firstOf(
                    this::doctype,
                    this::htmlComment,
                    this::erbComment,
                    this::erbNode,
                    this::htmlElement,
                    this::newLine,
                    this::charData);
        }

        private Optional<Doctype> doctype() throws ErbStructureException {
            Optional<Token> opening = consume(TokenKind.DOCTYPE_OPEN);
            if (opening.isEmpty()) {
                return Optional.empty();
            }
            List<Node> parts = repeat(this::doctypePart);
            Token closing =
                    require(
                            () -> consume(TokenKind.ELEMENT_CLOSE),
                            found -> unexpected("Unterminated doctype declaration", opening.get().getLocation(), found));
            Doctype doctype = new Doctype(opening.get(), parts, closing, newLineMarker());
            if (firstDoctype != null) {
                throw new ErbStructureException(
                        "Duplicate doctype declaration at "
                                + doctype.getLocation()
                                + "; the first one is at "
                                + firstDoctype.getLocation(),
                        doctype.getLocation(),
                        firstDoctype.getLocation());
            }
            firstDoctype = doctype;
            return Optional.of(doctype);
        }

        private Optional<Node> doctypePart() throws ErbStructureException {
            return firstOf(
                    () -> consume(TokenKind.NAME),
                    () -> consume(TokenKind.UNQUOTED_VALUE),
                    this::quotedString);
        }

        private Optional<HtmlComment> htmlComment() {
            return consume(TokenKind.HTML_COMMENT).map(token -> new HtmlComment(token, newLineMarker()));
        }

        private Optional<ErbComment> erbComment() {
            return consume(TokenKind.ERB_COMMENT).map(token -> new ErbComment(token, newLineMarker()));
        }

        private Optional<NewLine> newLine() {
            return cursor.consumeAny(TokenKind.NEW_LINE, TokenKind.BLANK_LINE)
                    .map(token -> new NewLine(token.getLocation(), token.getKind() == TokenKind.BLANK_LINE ? 2 : 1));
        }

        private Optional<CharData> charData() {
            List<Token> parts = new ArrayList<>();
            Optional<Token> next;
            while ((next = cursor.consumeAny(TokenKind.TEXT, TokenKind.WHITESPACE)).isPresent()) {
                parts.add(next.get());
            }
            if (parts.isEmpty()) {
                return Optional.empty();
            }
            StringBuilder text = new StringBuilder();
            for (Token part : parts) {
                text.append(part.getText());
            }
            Location location = parts.get(0).getLocation().to(parts.get(parts.size() - 1).getLocation());
            return Optional.of(new CharData(new Token(TokenKind.TEXT, text.toString(), location), newLineMarker()));
        }

        /** A single ERB tag, whatever its keyword. */
        private Optional<ErbTag> erbTag() throws ErbStructureException {
            Optional<Token> opening = consume(TokenKind.ERB_OPEN);
            if (opening.isEmpty()) {
                return Optional.empty();
            }
            Token keyword = null;
            if (cursor.peek().getKind().isKeyword()) {
                keyword = consume(cursor.peek().getKind()).orElseThrow();
            }
            StringBuilder code = new StringBuilder();
            Optional<Token> next;
            while ((next = consume(TokenKind.CODE)).isPresent()) {
                code.append(next.get().getText());
            }
            Token closing =
                    require(
                            () -> cursor.consumeAny(
                                    TokenKind.ERB_CLOSE, TokenKind.ERB_TRIM_CLOSE, TokenKind.ERB_DO_CLOSE),
                            found -> unexpected("Unterminated ERB tag", opening.get().getLocation(), found));
            return Optional.of(new ErbTag(opening.get(), keyword, new ErbContent(code.toString()), closing, newLineMarker()));
        }

        /** An ERB tag in content position: a plain tag, a do-block or a whole control chain. */
        private Optional<Node> erbNode() throws ErbStructureException {
            Optional<ErbTag> parsed = erbTag();
            if (parsed.isEmpty()) {
                return Optional.empty();
            }
            ErbTag tag = parsed.get();
            String keyword = tag.getKeywordText();
            if (keyword == null) {
                return Optional.of(tag.opensBlock() ? block(tag) : tag);
            }
            if (!CHAIN_HEADS.contains(keyword)) {
                // elsif, else, when and end only close a construct opened earlier.
                return Optional.empty();
            }
            if (tag.opensBlock()) {
                return Optional.of(block(tag));
            }
            if (selfTerminated(tag)) {
                LOGGER.log(
                        Level.FINE,
                        "Treating self-terminated {0} tag at {1} as a plain tag",
                        new Object[] {keyword, tag.getLocation()});
                return Optional.of(foldKeyword(tag));
            }
            switch (keyword) {
                case "if": {
                    LinkBody body = linkBody(tag, IF_LINKS);
                    return Optional.of(new ErbIf(tag, body.elements, ifTerminator(body.terminator)));
                }
                case "unless": {
                    LinkBody body = linkBody(tag, UNLESS_LINKS);
                    return Optional.of(new ErbUnless(tag, body.elements, unlessTerminator(body.terminator)));
                }
                default: {
                    LinkBody body = linkBody(tag, CASE_LINKS);
                    return Optional.of(new ErbCase(tag, body.elements, caseTerminator(body.terminator)));
                }
            }
        }

        private boolean selfTerminated(ErbTag tag) {
            String code = tag.getKeyword().getText() + tag.getContent().getValue();
            return codeFormatter.parse(code).isPresent();
        }

        private static ErbTag foldKeyword(ErbTag tag) {
            ErbContent content = new ErbContent(tag.getKeyword().getText() + tag.getContent().getValue());
            return new ErbTag(tag.getOpening(), null, content, tag.getClosing(), tag.getNewLine());
        }

        private ErbBlock block(ErbTag head) throws ErbStructureException {
            LinkBody body = linkBody(head, END_ONLY);
            return new ErbBlock(head, body.elements, end(body.terminator));
        }

        /**
         * Collects body nodes until a keyword tag from {@code accepted} closes the link. A keyword tag
         * outside {@code accepted}, or input that fits nothing, fails the whole chain.
         */
        private LinkBody linkBody(ErbTag head, Set<String> accepted) throws ErbStructureException {
            List<Node> elements = new ArrayList<>();
            while (true) {
                Optional<ErbTag> link = optional(this::linkTag);
                if (link.isPresent()) {
                    ErbTag tag = link.get();
                    if (accepted.contains(tag.getKeywordText())) {
                        return new LinkBody(elements, tag);
                    }
                    throw new ErbStructureException(
                            "Unexpected <% "
                                    + tag.getKeywordText()
                                    + " %> at "
                                    + tag.getLocation()
                                    + " inside "
                                    + describeHead(head),
                            head.getLocation(),
                            tag.getLocation());
                }
                Optional<Node> node = optional(this::anyNode);
                if (node.isPresent()) {
                    elements.add(node.get());
                    continue;
                }
                Token found = cursor.peek();
                if (found.getKind() == TokenKind.EOF) {
                    throw new ErbStructureException(
                            "No matching <% end %> for " + describeHead(head), head.getLocation(), found.getLocation());
                }
                Location span = tagSpan(found);
                throw new ErbStructureException(
                        "Unexpected " + describe(found) + " at " + span + " inside " + describeHead(head),
                        head.getLocation(),
                        span);
            }
        }

        private Optional<ErbTag> linkTag() throws ErbStructureException {
            Optional<ErbTag> tag = erbTag();
            if (tag.isEmpty()) {
                return Optional.empty();
            }
            String keyword = tag.get().getKeywordText();
            if (keyword == null || CHAIN_HEADS.contains(keyword)) {
                return Optional.empty();
            }
            return tag;
        }

        private IfTerminator ifTerminator(ErbTag tag) throws ErbStructureException {
            switch (tag.getKeywordText()) {
                case "elsif": {
                    LinkBody body = linkBody(tag, IF_LINKS);
                    return new ErbElsif(tag, body.elements, ifTerminator(body.terminator));
                }
                case "else":
                    return elseLink(tag);
                default:
                    return end(tag);
            }
        }

        private UnlessTerminator unlessTerminator(ErbTag tag) throws ErbStructureException {
            if ("else".equals(tag.getKeywordText())) {
                return elseLink(tag);
            }
            return end(tag);
        }

        private CaseTerminator caseTerminator(ErbTag tag) throws ErbStructureException {
            switch (tag.getKeywordText()) {
                case "when": {
                    LinkBody body = linkBody(tag, CASE_LINKS);
                    return new ErbCaseWhen(tag, body.elements, caseTerminator(body.terminator));
                }
                case "else":
                    return elseLink(tag);
                default:
                    return end(tag);
            }
        }

        private ErbElse elseLink(ErbTag tag) throws ErbStructureException {
            LinkBody body = linkBody(tag, END_ONLY);
            return new ErbElse(tag, body.elements, end(body.terminator));
        }

        private static ErbEnd end(ErbTag tag) throws ErbStructureException {
            if (tag.opensBlock()) {
                throw new ErbStructureException(
                        "<% end %> cannot open a block at " + tag.getLocation(), tag.getLocation(), tag.getClosing().getLocation());
            }
            return new ErbEnd(tag);
        }

        private Optional<HtmlElement> htmlElement() throws ErbStructureException {
            Optional<Token> opening = consume(TokenKind.ELEMENT_OPEN);
            if (opening.isEmpty()) {
                return Optional.empty();
            }
            Token name =
                    require(
                            () -> consume(TokenKind.NAME),
                            found -> unexpected("Invalid element name", opening.get().getLocation(), found));
            if (name.getText().startsWith("@") || name.getText().startsWith(":")) {
                throw new ErbStructureException(
                        "Invalid element name '" + name.getText() + "' at " + name.getLocation(),
                        opening.get().getLocation().to(name.getLocation()),
                        name.getLocation());
            }
            List<Node> attributes = repeat(() -> firstOf(this::attribute, this::erbTag));
            Token closing =
                    require(
                            () -> cursor.consumeAny(TokenKind.ELEMENT_CLOSE, TokenKind.ELEMENT_SELF_CLOSE),
                            found -> unexpected("Unterminated opening tag <" + name.getText() + ">", opening.get().getLocation(), found));
            OpeningTag openingTag = new OpeningTag(opening.get(), name, attributes, closing, newLineMarker());
            if (openingTag.isSelfClosing() || HtmlElement.isVoidElement(name.getText())) {
                return Optional.of(HtmlElement.withoutBody(openingTag));
            }

            List<Node> elements = repeat(this::anyNode);
            Optional<Token> closingOpen = consume(TokenKind.CLOSING_ELEMENT_OPEN);
            if (closingOpen.isEmpty()) {
                Token found = cursor.peek();
                String problem = found.getKind() == TokenKind.EOF ? "Missing closing tag" : "Unexpected " + describe(found);
                throw new ErbStructureException(
                        problem + " for <" + name.getText() + "> opened at " + openingTag.getLocation(),
                        openingTag.getLocation(),
                        tagSpan(found));
            }
            Token closingName =
                    require(
                            () -> consume(TokenKind.NAME),
                            found -> unexpected("Expected an element name", closingOpen.get().getLocation(), found));
            if (!closingName.getText().equals(name.getText())) {
                throw new ErbStructureException(
                        "Closing tag </"
                                + closingName.getText()
                                + "> at "
                                + closingName.getLocation()
                                + " does not match <"
                                + name.getText()
                                + "> opened at "
                                + openingTag.getLocation(),
                        openingTag.getLocation(),
                        closingOpen.get().getLocation().to(closingName.getLocation()));
            }
            Token closingClose =
                    require(
                            () -> consume(TokenKind.ELEMENT_CLOSE),
                            found -> unexpected("Unterminated closing tag </" + name.getText() + ">", closingOpen.get().getLocation(), found));
            ClosingTag closingTag = new ClosingTag(closingOpen.get(), closingName, closingClose);
            return Optional.of(HtmlElement.withBody(openingTag, elements, closingTag, newLineMarker()));
        }

        private Optional<HtmlAttribute> attribute() throws ErbStructureException {
            Optional<Token> key = consume(TokenKind.NAME);
            if (key.isEmpty()) {
                return Optional.empty();
            }
            Optional<Token> equals = consume(TokenKind.EQUALS);
            if (equals.isEmpty()) {
                return Optional.of(new HtmlAttribute(key.get(), null, null));
            }
            HtmlString value =
                    require(
                            this::attributeValue,
                            found -> unexpected("Missing value for attribute '" + key.get().getText() + "'", key.get().getLocation(), found));
            return Optional.of(new HtmlAttribute(key.get(), equals.get(), value));
        }

        private Optional<HtmlString> attributeValue() throws ErbStructureException {
            Optional<HtmlString> quoted = optional(this::quotedString);
            if (quoted.isPresent()) {
                return quoted;
            }
            return cursor.consumeAny(TokenKind.NAME, TokenKind.UNQUOTED_VALUE).map(HtmlString::bare);
        }

        private Optional<HtmlString> quotedString() throws ErbStructureException {
            Optional<Token> openQuote = cursor.consumeAny(TokenKind.DOUBLE_QUOTE, TokenKind.SINGLE_QUOTE);
            if (openQuote.isEmpty()) {
                return Optional.empty();
            }
            List<Node> contents = repeat(() -> firstOf(() -> consume(TokenKind.STRING_TEXT), this::erbTag));
            TokenKind quoteKind = openQuote.get().getKind();
            Token closeQuote =
                    require(
                            () -> consume(quoteKind),
                            found -> unexpected("Unterminated quoted string", openQuote.get().getLocation(), found));
            return Optional.of(new HtmlString(openQuote.get(), contents, closeQuote));
        }

        // Diagnostics.

        private static ErbStructureException unexpected(String problem, Location construct, Token found) {
            return new ErbStructureException(
                    problem + " opened at " + construct + ": found " + describeToken(found) + " at " + found.getLocation(),
                    construct,
                    found.getLocation());
        }

        /** Location of {@code found} widened to its closing delimiter when it opens an ERB tag. */
        private Location tagSpan(Token found) {
            if (found.getKind() != TokenKind.ERB_OPEN) {
                return found.getLocation();
            }
            for (int distance = 1; ; distance++) {
                Token next = cursor.peek(distance);
                switch (next.getKind()) {
                    case ERB_CLOSE:
                    case ERB_TRIM_CLOSE:
                    case ERB_DO_CLOSE:
                        return found.getLocation().to(next.getLocation());
                    case EOF:
                        return found.getLocation();
                    default:
                        break;
                }
            }
        }

        private String describe(Token token) {
            if (token.getKind() == TokenKind.ERB_OPEN && cursor.peek(1).getKind().isKeyword()) {
                return "<%" + cursor.peek(1).getText() + " %>";
            }
            return describeToken(token);
        }

        private static String describeToken(Token token) {
            switch (token.getKind()) {
                case EOF:
                    return "end of input";
                case CLOSING_ELEMENT_OPEN:
                    return "closing tag";
                case NEW_LINE:
                case BLANK_LINE:
                    return "line break";
                default:
                    return "'" + token.getText().strip() + "'";
            }
        }

        private static String describeHead(ErbTag head) {
            String keyword = head.getKeywordText();
            String name = keyword == null ? "block" : "<% " + keyword + " %>";
            return name + " opened at " + head.getLocation();
        }
    }
}
