package org.dazzle.dsl;

import org.dazzle.dsl.Token.TokenType;
import org.dazzle.dsl.definition.AutoTransitionSpec;
import org.dazzle.dsl.definition.ComputedField;
import org.dazzle.dsl.definition.Constraint;
import org.dazzle.dsl.definition.DomainServiceDefinition;
import org.dazzle.dsl.definition.DomainServiceDefinition.ServiceField;
import org.dazzle.dsl.definition.EntityDefinition;
import org.dazzle.dsl.definition.FieldDefinition;
import org.dazzle.dsl.definition.FieldModifier;
import org.dazzle.dsl.definition.FieldType;
import org.dazzle.dsl.definition.FieldType.RelationshipBehavior;
import org.dazzle.dsl.definition.FieldTypeKind;
import org.dazzle.dsl.definition.Fragment;
import org.dazzle.dsl.definition.Guard;
import org.dazzle.dsl.definition.InvariantDefinition;
import org.dazzle.dsl.definition.LlmConfigDefinition;
import org.dazzle.dsl.definition.LlmIntentDefinition;
import org.dazzle.dsl.definition.LlmIntentDefinition.RetryPolicy;
import org.dazzle.dsl.definition.LlmModelDefinition;
import org.dazzle.dsl.definition.ModuleDefinition;
import org.dazzle.dsl.definition.ModuleDefinition.AppDeclaration;
import org.dazzle.dsl.definition.ModuleDefinition.UseDeclaration;
import org.dazzle.dsl.definition.StateMachine;
import org.dazzle.dsl.definition.Transition;
import org.dazzle.dsl.definition.VocabularyEntry;
import org.dazzle.dsl.expression.Expr;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parser for DSL module files.
 *
 * A file is an optional header ({@code module}, {@code use}, {@code app})
 * followed by top-level declarations: {@code entity}, {@code service},
 * {@code llm_model}, {@code llm_intent}, {@code llm_config} and
 * {@code vocabulary}. Blocks are delimited by indentation.
 *
 * Expressions inside guards, computed fields and invariants are handled by
 * the inherited {@link ExpressionParser} grammar.
 */
public final class DslParser extends ExpressionParser {

    private static final String DEFAULT_MODULE_NAME = "main";

    private static final Set<String> SIMPLE_TYPES = Set.of(
            "text", "int", "bool", "date", "datetime", "uuid", "email");

    private static final String TRANSITION_SYNTAX_HELP = "  Supported syntax:\n"
            + "    requires field_name     # Field must not be null\n"
            + "    role(role_name)         # User must have role";

    private DslParser(List<Token> tokens, String file) {
        super(tokens, file);
    }

    /**
     * Parses a module from source text.
     *
     * @throws DslParseException on the first syntax error
     */
    public static ModuleDefinition parse(String source) {
        return parse(source, null);
    }

    /**
     * Parses a module from source text, reporting errors against the given file.
     *
     * @param source The DSL source
     * @param file   The source file name used in error locations, may be null
     */
    public static ModuleDefinition parse(String source, String file) {
        DslParser parser = new DslParser(new DslLexer(source, file).tokenize(), file);
        return parser.parseModule();
    }

    // ==================== Module ====================

    private ModuleDefinition parseModule() {
        String moduleName = null;
        List<UseDeclaration> uses = new ArrayList<>();
        AppDeclaration app = null;

        skipNewlines();
        while (checkWord("module") || checkWord("use") || checkWord("app")) {
            Token keyword = advance();
            switch (keyword.value()) {
                case "module" -> {
                    if (moduleName != null) {
                        throw error("Duplicate module declaration", keyword);
                    }
                    moduleName = parseDottedName();
                }
                case "use" -> {
                    String used = parseDottedName();
                    String alias = matchWord("as") ? consumeIdentifier("alias after 'as'") : null;
                    uses.add(new UseDeclaration(used, alias));
                }
                default -> {
                    String appName = consumeIdentifier("app name");
                    String title = check(TokenType.STRING) ? advance().value() : null;
                    app = new AppDeclaration(appName, title);
                }
            }
            endLine();
            skipNewlines();
        }

        List<EntityDefinition> entities = new ArrayList<>();
        List<DomainServiceDefinition> services = new ArrayList<>();
        List<LlmModelDefinition> llmModels = new ArrayList<>();
        List<LlmIntentDefinition> llmIntents = new ArrayList<>();
        List<VocabularyEntry> vocabulary = new ArrayList<>();
        LlmConfigDefinition llmConfig = null;

        while (!isAtEnd()) {
            Token token = peek();
            if (!token.is(TokenType.IDENTIFIER)) {
                throw error("Expected a declaration, found " + describe(token));
            }
            switch (token.value()) {
                case "entity" -> entities.add(parseEntity());
                case "service" -> services.add(parseService());
                case "llm_model" -> llmModels.add(parseLlmModel());
                case "llm_intent" -> llmIntents.add(parseLlmIntent());
                case "llm_config" -> {
                    if (llmConfig != null) {
                        throw error("Only one llm_config block is allowed per module", token);
                    }
                    llmConfig = parseLlmConfig();
                }
                case "vocabulary" -> vocabulary.addAll(parseVocabulary());
                case "module", "use", "app" -> throw error(
                        "'" + token.value() + "' must appear in the module header, before any declaration", token);
                default -> throw error("Unknown declaration '" + token.value() + "'", token);
            }
            skipNewlines();
        }

        Fragment fragment = new Fragment(entities, services, llmModels, llmIntents, llmConfig, vocabulary);
        return new ModuleDefinition(moduleName != null ? moduleName : DEFAULT_MODULE_NAME,
                file, uses, app, fragment);
    }

    private String parseDottedName() {
        StringBuilder name = new StringBuilder(consumeIdentifier("module name"));
        while (match(TokenType.DOT)) {
            name.append('.').append(consumeIdentifier("module name segment after '.'"));
        }
        return name.toString();
    }

    // ==================== Entity ====================

    private EntityDefinition parseEntity() {
        consumeWord("entity");
        Token nameToken = peek();
        String name = consumeIdentifier("entity name");
        String title = check(TokenType.STRING) ? advance().value() : null;
        beginBlock();

        List<FieldDefinition> fields = new ArrayList<>();
        List<ComputedField> computedFields = new ArrayList<>();
        List<Constraint> constraints = new ArrayList<>();
        List<InvariantDefinition> invariants = new ArrayList<>();
        List<Transition> transitions = null;
        Token transitionsToken = null;

        while (!endOfBlock()) {
            Token token = peek();
            if (token.isWord("invariant") && peekAhead(1).is(TokenType.COLON)) {
                invariants.add(parseInvariant());
            } else if (token.isWord("transitions") && peekAhead(1).is(TokenType.COLON)) {
                if (transitions != null) {
                    throw error("Duplicate transitions block in entity '" + name + "'", token);
                }
                transitionsToken = token;
                transitions = parseTransitions();
            } else if (token.isWord("unique") || token.isWord("index")) {
                constraints.add(parseConstraint());
            } else {
                String fieldName = consumeIdentifier("field name");
                consume(TokenType.COLON, "Expected ':' after field name '" + fieldName + "'");
                if (matchWord("computed")) {
                    computedFields.add(new ComputedField(fieldName, parseExpression()));
                } else {
                    fields.add(parseField(fieldName));
                }
                endLine();
            }
        }

        StateMachine stateMachine = null;
        if (transitions != null) {
            FieldDefinition status = fields.stream()
                    .filter(f -> f.name().equals("status") && f.type().kind() == FieldTypeKind.ENUM)
                    .findFirst()
                    .orElseThrow(() -> new DslParseException(
                            "Entity '" + name + "' declares transitions but has no enum field 'status'",
                            file, nameToken.line(), nameToken.column()));
            if (transitions.isEmpty()) {
                throw error("Empty transitions block in entity '" + name + "'", transitionsToken);
            }
            stateMachine = new StateMachine(status.name(), status.type().enumValues(), transitions);
        }

        return new EntityDefinition(name, title, fields, computedFields, constraints, stateMachine, invariants);
    }

    private Constraint parseConstraint() {
        Constraint.Kind kind = advance().value().equals("unique") ? Constraint.Kind.UNIQUE : Constraint.Kind.INDEX;
        match(TokenType.COLON);
        List<String> fields = new ArrayList<>();
        fields.add(consumeIdentifier("field name in constraint"));
        while (match(TokenType.COMMA)) {
            fields.add(consumeIdentifier("field name in constraint"));
        }
        endLine();
        return new Constraint(kind, fields);
    }

    private FieldDefinition parseField(String name) {
        FieldType type = parseFieldType();
        Set<FieldModifier> modifiers = EnumSet.noneOf(FieldModifier.class);
        Object defaultValue = null;

        while (!check(TokenType.NEWLINE) && !isAtEnd() && !check(TokenType.DEDENT)) {
            if (match(TokenType.ASSIGN)) {
                defaultValue = parseDefaultValue();
                continue;
            }
            Token token = peek();
            FieldModifier modifier = token.is(TokenType.IDENTIFIER) ? modifierFor(token.value()) : null;
            if (modifier == null) {
                throw error("Unknown field modifier " + describe(token) + " on field '" + name + "'");
            }
            advance();
            if (modifier == FieldModifier.UNIQUE && match(TokenType.QUESTION)) {
                modifier = FieldModifier.UNIQUE_NULLABLE;
            }
            modifiers.add(modifier);
        }
        return new FieldDefinition(name, type, modifiers, defaultValue);
    }

    private static FieldModifier modifierFor(String word) {
        for (FieldModifier modifier : FieldModifier.values()) {
            if (modifier.dslName().equals(word)) {
                return modifier;
            }
        }
        return null;
    }

    private Object parseDefaultValue() {
        Token token = advance();
        return switch (token.type()) {
            case STRING -> token.value();
            case INTEGER -> parseLong(token);
            case DECIMAL -> Double.parseDouble(token.value());
            case IDENTIFIER -> switch (token.value()) {
                case "true" -> Boolean.TRUE;
                case "false" -> Boolean.FALSE;
                default -> token.value();
            };
            default -> throw error("Expected default value after '=', found " + describe(token), token);
        };
    }

    private FieldType parseFieldType() {
        Token token = peek();
        String word = consumeIdentifier("field type");

        if (SIMPLE_TYPES.contains(word)) {
            return FieldType.of(FieldTypeKind.fromDslName(word));
        }
        switch (word) {
            case "str": {
                if (!match(TokenType.LPAREN)) {
                    return FieldType.of(FieldTypeKind.STR);
                }
                int maxLength = parseInt("max length");
                consume(TokenType.RPAREN, "Expected ')' after str length");
                return FieldType.str(maxLength);
            }
            case "decimal": {
                consume(TokenType.LPAREN, "Expected '(' after decimal");
                int precision = parseInt("precision");
                consume(TokenType.COMMA, "Expected ',' between precision and scale");
                int scale = parseInt("scale");
                consume(TokenType.RPAREN, "Expected ')' after decimal scale");
                return FieldType.decimal(precision, scale);
            }
            case "money": {
                String currency = FieldType.DEFAULT_CURRENCY;
                if (match(TokenType.LPAREN)) {
                    currency = consumeIdentifier("currency code").toUpperCase(Locale.ROOT);
                    consume(TokenType.RPAREN, "Expected ')' after currency");
                }
                return FieldType.money(currency);
            }
            case "enum": {
                consume(TokenType.LBRACKET, "Expected '[' after enum");
                List<String> values = new ArrayList<>();
                values.add(consumeIdentifier("enum value"));
                while (match(TokenType.COMMA)) {
                    values.add(consumeIdentifier("enum value"));
                }
                consume(TokenType.RBRACKET, "Expected ']' after enum values");
                return FieldType.enumOf(values);
            }
            case "ref":
            case "embeds":
            case "belongs_to":
                return FieldType.relation(FieldTypeKind.fromDslName(word),
                        consumeIdentifier("entity name after '" + word + "'"), null, false);
            case "has_many":
            case "has_one": {
                String target = consumeIdentifier("entity name after '" + word + "'");
                RelationshipBehavior behavior = null;
                boolean readonly = false;
                while (check(TokenType.IDENTIFIER)) {
                    String option = peek().value();
                    if (option.equals("readonly")) {
                        readonly = true;
                    } else if (option.equals("cascade")) {
                        behavior = RelationshipBehavior.CASCADE;
                    } else if (option.equals("restrict")) {
                        behavior = RelationshipBehavior.RESTRICT;
                    } else if (option.equals("nullify") && word.equals("has_many")) {
                        behavior = RelationshipBehavior.NULLIFY;
                    } else {
                        break;
                    }
                    advance();
                }
                return FieldType.relation(FieldTypeKind.fromDslName(word), target, behavior, readonly);
            }
            default:
                throw error("Unknown type: " + word, token);
        }
    }

    // ==================== Invariants ====================

    private InvariantDefinition parseInvariant() {
        consumeWord("invariant");
        consume(TokenType.COLON, "Expected ':' after 'invariant'");
        Expr expression = parseInvariantExpression();
        String message = null;
        String code = null;

        if (check(TokenType.NEWLINE) && peekAhead(1).is(TokenType.INDENT)) {
            beginBlock();
            while (!endOfBlock()) {
                Token key = peek();
                if (matchWord("message")) {
                    consume(TokenType.COLON, "Expected ':' after 'message'");
                    message = consume(TokenType.STRING, "Expected string message").value();
                } else if (matchWord("code")) {
                    consume(TokenType.COLON, "Expected ':' after 'code'");
                    code = consumeIdentifier("invariant code");
                } else {
                    throw error("Expected 'message:' or 'code:' under invariant, found " + describe(key));
                }
                endLine();
            }
        } else {
            endLine();
        }
        return new InvariantDefinition(expression, message, code);
    }

    // ==================== Transitions ====================

    private List<Transition> parseTransitions() {
        consumeWord("transitions");
        beginBlock();
        List<Transition> transitions = new ArrayList<>();
        while (!endOfBlock()) {
            transitions.add(parseTransition());
        }
        return transitions;
    }

    private Transition parseTransition() {
        String from = match(TokenType.STAR) ? Transition.WILDCARD : consumeIdentifier("source state");
        consume(TokenType.ARROW, "Expected '->' after source state '" + from + "'");
        String to = consumeIdentifier("target state");

        TransitionParts parts = new TransitionParts();
        if (match(TokenType.COLON)) {
            if (check(TokenType.NEWLINE) && peekAhead(1).is(TokenType.INDENT)) {
                parseTransitionBlock(parts);
                return parts.build(from, to);
            }
            parseConditions(parts);
        }
        endLine();
        return parts.build(from, to);
    }

    private void parseTransitionBlock(TransitionParts parts) {
        beginBlock();
        while (!endOfBlock()) {
            if (checkWord("guard") && peekAhead(1).is(TokenType.COLON)) {
                advance();
                advance();
                Expr expression = parseExpression();
                String message = null;
                if (check(TokenType.NEWLINE) && peekAhead(1).is(TokenType.INDENT)) {
                    beginBlock();
                    while (!endOfBlock()) {
                        consumeWord("message");
                        consume(TokenType.COLON, "Expected ':' after 'message'");
                        message = consume(TokenType.STRING, "Expected string message").value();
                        endLine();
                    }
                } else {
                    endLine();
                }
                parts.guards.add(new Guard.ExpressionGuard(expression, message));
            } else {
                parseConditions(parts);
                endLine();
            }
        }
    }

    /**
     * Parses inline conditions up to the end of the line:
     * {@code requires f}, {@code role(r)}, {@code auto after N [unit] [or manual]},
     * {@code manual}, with {@code or} as a connector.
     */
    private void parseConditions(TransitionParts parts) {
        while (!check(TokenType.NEWLINE) && !check(TokenType.DEDENT) && !isAtEnd()) {
            Token token = peek();
            if (matchWord("requires")) {
                parts.guards.add(new Guard.RequiresField(consumeIdentifier("field name after 'requires'")));
            } else if (matchWord("role")) {
                consume(TokenType.LPAREN, "Expected '(' after 'role'");
                parts.guards.add(new Guard.RequiresRole(consumeIdentifier("role name")));
                consume(TokenType.RPAREN, "Expected ')' after role name");
            } else if (matchWord("auto")) {
                parts.auto = parseAutoSpec();
            } else if (matchWord("manual") || matchWord("or")) {
                continue;
            } else if (isComparison(token)) {
                throw error("Transition conditions don't support comparison operators like '"
                        + token.value() + "'.\n"
                        + TRANSITION_SYNTAX_HELP + "\n"
                        + "    auto after N days       # Auto-transition with delay\n"
                        + "  Example: open -> assigned: requires assignee", token);
            } else if (token.is(TokenType.IDENTIFIER)) {
                throw error("Unexpected identifier '" + token.value() + "' in transition condition.\n"
                        + "  Did you mean: requires " + token.value() + "\n"
                        + TRANSITION_SYNTAX_HELP, token);
            } else {
                throw error("Unexpected " + describe(token) + " in transition condition");
            }
        }
    }

    private AutoTransitionSpec parseAutoSpec() {
        if (!matchWord("after")) {
            return new AutoTransitionSpec(0, AutoTransitionSpec.DelayUnit.DAYS, false);
        }
        int delay = parseInt("delay after 'auto after'");
        AutoTransitionSpec.DelayUnit unit = AutoTransitionSpec.DelayUnit.DAYS;
        if (check(TokenType.IDENTIFIER)) {
            AutoTransitionSpec.DelayUnit explicit = AutoTransitionSpec.DelayUnit.fromDsl(peek().value());
            if (explicit != null) {
                advance();
                unit = explicit;
            }
        }
        boolean allowManual = false;
        if (checkWord("or") && peekAhead(1).isWord("manual")) {
            advance();
            advance();
            allowManual = true;
        }
        return new AutoTransitionSpec(delay, unit, allowManual);
    }

    private static boolean isComparison(Token token) {
        return switch (token.type()) {
            case EQUALS, NOT_EQUALS, LESS_THAN, GREATER_THAN, LESS_THAN_EQ, GREATER_THAN_EQ, ASSIGN -> true;
            default -> false;
        };
    }

    private static final class TransitionParts {
        private final List<Guard> guards = new ArrayList<>();
        private AutoTransitionSpec auto;

        private Transition build(String from, String to) {
            return new Transition(from, to, guards, auto);
        }
    }

    // ==================== Domain services ====================

    private DomainServiceDefinition parseService() {
        consumeWord("service");
        String name = consumeIdentifier("service name");
        String title = check(TokenType.STRING) ? advance().value() : null;
        beginBlock();

        DomainServiceDefinition.Kind kind = null;
        List<ServiceField> inputs = List.of();
        List<ServiceField> outputs = List.of();
        List<String> guarantees = new ArrayList<>();
        String stub = null;

        while (!endOfBlock()) {
            Token key = peek();
            String directive = consumeIdentifier("service directive");
            consume(TokenType.COLON, "Expected ':' after '" + directive + "'");
            switch (directive) {
                case "kind" -> {
                    Token kindToken = peek();
                    String value = consumeIdentifier("service kind");
                    kind = DomainServiceDefinition.Kind.fromDsl(value);
                    if (kind == null) {
                        throw error("Unknown service kind '" + value
                                + "'. Expected domain_logic, validation, integration or workflow", kindToken);
                    }
                    endLine();
                }
                case "input" -> inputs = parseServiceFields();
                case "output" -> outputs = parseServiceFields();
                case "guarantees" -> {
                    beginBlock();
                    while (!endOfBlock()) {
                        consume(TokenType.MINUS, "Expected '-' before guarantee");
                        guarantees.add(consume(TokenType.STRING, "Expected guarantee text").value());
                        endLine();
                    }
                }
                case "stub" -> {
                    stub = consumeIdentifier("stub language");
                    endLine();
                }
                default -> throw error("Unknown service directive '" + directive + "'", key);
            }
        }
        return new DomainServiceDefinition(name, title, kind, inputs, outputs, guarantees, stub);
    }

    private List<ServiceField> parseServiceFields() {
        beginBlock();
        List<ServiceField> fields = new ArrayList<>();
        while (!endOfBlock()) {
            String name = consumeIdentifier("parameter name");
            consume(TokenType.COLON, "Expected ':' after parameter '" + name + "'");
            StringBuilder typeName = new StringBuilder(consumeIdentifier("parameter type"));
            if (match(TokenType.LPAREN)) {
                typeName.append('(');
                while (!check(TokenType.RPAREN)) {
                    Token part = advance();
                    if (part.is(TokenType.EOF) || part.is(TokenType.NEWLINE)) {
                        throw error("Expected ')' in type of parameter '" + name + "'", part);
                    }
                    typeName.append(part.value());
                }
                advance();
                typeName.append(')');
            }
            boolean required = matchWord("required");
            endLine();
            fields.add(new ServiceField(name, typeName.toString(), required));
        }
        return fields;
    }

    // ==================== LLM declarations ====================

    private LlmModelDefinition parseLlmModel() {
        Token start = consumeWord("llm_model");
        String name = consumeIdentifier("llm_model name");
        String title = check(TokenType.STRING) ? advance().value() : null;
        beginBlock();

        LlmModelDefinition.Provider provider = null;
        String modelId = null;
        LlmModelDefinition.Tier tier = LlmModelDefinition.Tier.BALANCED;
        int maxTokens = LlmModelDefinition.DEFAULT_MAX_TOKENS;
        BigDecimal costInput = null;
        BigDecimal costOutput = null;

        while (!endOfBlock()) {
            Token key = peek();
            String property = consumeIdentifier("llm_model property");
            consume(TokenType.COLON, "Expected ':' after '" + property + "'");
            switch (property) {
                case "provider" -> provider = parseEnumWord(LlmModelDefinition.Provider.class, "provider");
                case "model_id" -> modelId = parseLooseValue();
                case "tier" -> tier = parseEnumWord(LlmModelDefinition.Tier.class, "tier");
                case "max_tokens" -> maxTokens = parseInt("max_tokens");
                case "cost_per_1k_input" -> costInput = parseDecimal(property);
                case "cost_per_1k_output" -> costOutput = parseDecimal(property);
                default -> throw error("Unknown llm_model property '" + property + "'", key);
            }
            endLine();
        }

        if (provider == null) {
            throw error("llm_model '" + name + "' requires provider", start);
        }
        if (modelId == null) {
            throw error("llm_model '" + name + "' requires model_id", start);
        }
        return new LlmModelDefinition(name, title, provider, modelId, tier, maxTokens, costInput, costOutput);
    }

    private LlmIntentDefinition parseLlmIntent() {
        Token start = consumeWord("llm_intent");
        String name = consumeIdentifier("llm_intent name");
        String title = check(TokenType.STRING) ? advance().value() : null;
        beginBlock();

        String model = null;
        String prompt = null;
        String outputSchema = null;
        int timeout = LlmIntentDefinition.DEFAULT_TIMEOUT_SECONDS;
        RetryPolicy retry = null;

        while (!endOfBlock()) {
            Token key = peek();
            String property = consumeIdentifier("llm_intent property");
            consume(TokenType.COLON, "Expected ':' after '" + property + "'");
            switch (property) {
                case "model" -> {
                    model = consumeIdentifier("model name");
                    endLine();
                }
                case "prompt" -> {
                    prompt = consume(TokenType.STRING, "Expected prompt string").value();
                    endLine();
                }
                case "output_schema" -> {
                    outputSchema = consumeIdentifier("entity name");
                    endLine();
                }
                case "timeout" -> {
                    timeout = parseInt("timeout seconds");
                    endLine();
                }
                case "retry" -> retry = parseRetry();
                default -> throw error("Unknown llm_intent property '" + property + "'", key);
            }
        }

        if (prompt == null) {
            throw error("llm_intent '" + name + "' requires prompt", start);
        }
        return new LlmIntentDefinition(name, title, model, prompt, outputSchema, timeout, retry);
    }

    private RetryPolicy parseRetry() {
        RetryPolicy defaults = RetryPolicy.defaults();
        int maxAttempts = defaults.maxAttempts();
        RetryPolicy.Backoff backoff = defaults.backoff();
        beginBlock();
        while (!endOfBlock()) {
            Token key = peek();
            String property = consumeIdentifier("retry property");
            consume(TokenType.COLON, "Expected ':' after '" + property + "'");
            switch (property) {
                case "max_attempts" -> maxAttempts = parseInt("max_attempts");
                case "backoff" -> backoff = parseEnumWord(RetryPolicy.Backoff.class, "backoff");
                default -> throw error("Unknown retry property '" + property + "'", key);
            }
            endLine();
        }
        return new RetryPolicy(maxAttempts, backoff);
    }

    private LlmConfigDefinition parseLlmConfig() {
        consumeWord("llm_config");
        beginBlock();

        String defaultModel = null;
        LlmConfigDefinition.ArtifactStore store = LlmConfigDefinition.ArtifactStore.LOCAL;
        Map<String, Integer> rateLimits = new LinkedHashMap<>();

        while (!endOfBlock()) {
            Token key = peek();
            String property = consumeIdentifier("llm_config property");
            consume(TokenType.COLON, "Expected ':' after '" + property + "'");
            switch (property) {
                case "default_model" -> {
                    defaultModel = consumeIdentifier("model name");
                    endLine();
                }
                case "artifact_store" -> {
                    store = parseEnumWord(LlmConfigDefinition.ArtifactStore.class, "artifact_store");
                    endLine();
                }
                case "rate_limits" -> {
                    beginBlock();
                    while (!endOfBlock()) {
                        String model = consumeIdentifier("model name");
                        consume(TokenType.COLON, "Expected ':' after model '" + model + "'");
                        rateLimits.put(model, parseInt("requests per minute"));
                        endLine();
                    }
                }
                default -> throw error("Unknown llm_config property '" + property + "'", key);
            }
        }
        return new LlmConfigDefinition(defaultModel, store, rateLimits);
    }

    // ==================== Vocabulary ====================

    private List<VocabularyEntry> parseVocabulary() {
        consumeWord("vocabulary");
        beginBlock();
        List<VocabularyEntry> entries = new ArrayList<>();
        while (!endOfBlock()) {
            String term = consumeIdentifier("vocabulary term");
            consume(TokenType.COLON, "Expected ':' after term '" + term + "'");
            entries.add(new VocabularyEntry(term, consume(TokenType.STRING, "Expected definition string").value()));
            endLine();
        }
        return entries;
    }

    // ==================== Helpers ====================

    private void skipNewlines() {
        while (match(TokenType.NEWLINE)) {
            // skip
        }
    }

    /**
     * Consumes {@code : NEWLINE INDENT}. The colon is optional when the
     * caller has already consumed it.
     */
    private void beginBlock() {
        match(TokenType.COLON);
        consume(TokenType.NEWLINE, "Expected end of line before block");
        consume(TokenType.INDENT, "Expected indented block");
    }

    /**
     * @return True, consuming the DEDENT, when the current block has ended
     */
    private boolean endOfBlock() {
        skipNewlines();
        if (match(TokenType.DEDENT)) {
            return true;
        }
        return isAtEnd();
    }

    private void endLine() {
        if (check(TokenType.DEDENT) || isAtEnd()) {
            return;
        }
        consume(TokenType.NEWLINE, "Expected end of line");
    }

    private int parseInt(String what) {
        Token token = consume(TokenType.INTEGER, "Expected " + what);
        try {
            return Integer.parseInt(token.value());
        } catch (NumberFormatException e) {
            throw error("Integer out of range: " + token.value(), token);
        }
    }

    private BigDecimal parseDecimal(String what) {
        Token token = peek();
        if (token.is(TokenType.DECIMAL) || token.is(TokenType.INTEGER)) {
            advance();
            return new BigDecimal(token.value());
        }
        throw error("Expected number for " + what + ", found " + describe(token));
    }

    private <E extends Enum<E>> E parseEnumWord(Class<E> type, String what) {
        Token token = peek();
        String word = consumeIdentifier(what);
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equalsIgnoreCase(word)) {
                return constant;
            }
        }
        List<String> allowed = new ArrayList<>();
        for (E constant : type.getEnumConstants()) {
            allowed.add(constant.name().toLowerCase(Locale.ROOT));
        }
        throw error("Unknown " + what + " '" + word + "'. Expected one of: " + String.join(", ", allowed), token);
    }

    /**
     * Reads a quoted string, or joins the raw tokens up to the end of the line
     * so unquoted ids such as {@code claude-3-haiku} are accepted.
     */
    private String parseLooseValue() {
        if (check(TokenType.STRING)) {
            return advance().value();
        }
        StringBuilder value = new StringBuilder();
        while (!check(TokenType.NEWLINE) && !check(TokenType.DEDENT) && !isAtEnd()) {
            value.append(advance().value());
        }
        if (value.length() == 0) {
            throw error("Expected value");
        }
        return value.toString();
    }
}
