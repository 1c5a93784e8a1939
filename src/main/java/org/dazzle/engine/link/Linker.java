package org.dazzle.engine.link;

import org.dazzle.dsl.definition.ComputedField;
import org.dazzle.dsl.definition.Constraint;
import org.dazzle.dsl.definition.DomainServiceDefinition;
import org.dazzle.dsl.definition.EntityDefinition;
import org.dazzle.dsl.definition.FieldDefinition;
import org.dazzle.dsl.definition.FieldModifier;
import org.dazzle.dsl.definition.FieldTypeKind;
import org.dazzle.dsl.definition.Fragment;
import org.dazzle.dsl.definition.Guard;
import org.dazzle.dsl.definition.InvariantDefinition;
import org.dazzle.dsl.definition.LlmConfigDefinition;
import org.dazzle.dsl.definition.LlmIntentDefinition;
import org.dazzle.dsl.definition.LlmModelDefinition;
import org.dazzle.dsl.definition.ModuleDefinition;
import org.dazzle.dsl.definition.StateMachine;
import org.dazzle.dsl.definition.Transition;
import org.dazzle.dsl.definition.VocabularyEntry;
import org.dazzle.dsl.expression.Expr;
import org.dazzle.dsl.expression.FieldRef;
import org.dazzle.dsl.expression.FieldRefCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Links parsed modules into one application.
 *
 * Linking is one flat pass over the modules in the order given: the
 * {@code use} graph is treated as a set of allowed imports, not as an
 * evaluation order. Duplicates are fatal ({@link LinkException}); every other
 * problem is returned as a list of messages so callers see all of them.
 */
public final class Linker {

    private static final Logger log = LoggerFactory.getLogger(Linker.class);

    /** Path roots that name the evaluation context rather than an entity field. */
    private static final Set<String> CONTEXT_ROOTS = Set.of("self", "current_user");

    private Linker() {
    }

    /**
     * Builds the symbol table and merges all modules into an {@link AppSpec}.
     * Reference problems are not checked here; see {@link #validateReferences}.
     *
     * @throws LinkException on duplicate modules or symbols, or a missing {@code use} target
     */
    public static AppSpec link(List<ModuleDefinition> modules) {
        return link(modules, buildSymbolTable(modules));
    }

    /**
     * Merges modules whose symbols are already registered.
     */
    public static AppSpec link(List<ModuleDefinition> modules, SymbolTable symbols) {
        String appName = null;
        String appTitle = null;
        List<VocabularyEntry> vocabulary = new ArrayList<>();
        for (ModuleDefinition module : modules) {
            if (module.app() != null && appName == null) {
                appName = module.app().name();
                appTitle = module.app().title();
            }
            vocabulary.addAll(module.fragment().vocabulary());
        }
        if (appName == null) {
            appName = modules.isEmpty() ? "app" : modules.get(0).name();
        }

        return new AppSpec(
                appName,
                appTitle,
                modules.stream().map(ModuleDefinition::name).toList(),
                List.copyOf(symbols.entities().values()),
                List.copyOf(symbols.services().values()),
                List.copyOf(symbols.llmModels().values()),
                List.copyOf(symbols.llmIntents().values()),
                symbols.llmConfig().orElse(null),
                vocabulary);
    }

    // ==================== Symbol table ====================

    /**
     * Registers every declaration of every module.
     *
     * @throws LinkException on duplicate module names, a {@code use} of an
     *                       undefined module, or a symbol defined twice
     */
    public static SymbolTable buildSymbolTable(List<ModuleDefinition> modules) {
        checkModules(modules);

        SymbolTable symbols = new SymbolTable();
        for (ModuleDefinition module : modules) {
            Fragment fragment = module.fragment();
            for (EntityDefinition entity : fragment.entities()) {
                symbols.add(SymbolKind.ENTITY, entity, module.name());
            }
            for (DomainServiceDefinition service : fragment.services()) {
                symbols.add(SymbolKind.SERVICE, service, module.name());
            }
            for (LlmModelDefinition model : fragment.llmModels()) {
                symbols.add(SymbolKind.LLM_MODEL, model, module.name());
            }
            for (LlmIntentDefinition intent : fragment.llmIntents()) {
                symbols.add(SymbolKind.LLM_INTENT, intent, module.name());
            }
            if (fragment.llmConfig() != null) {
                symbols.setLlmConfig(fragment.llmConfig(), module.name());
            }
        }
        log.debug("Linked {} module(s) into {} symbol(s)", modules.size(), symbols.size());
        return symbols;
    }

    private static void checkModules(List<ModuleDefinition> modules) {
        Map<String, ModuleDefinition> byName = new LinkedHashMap<>();
        for (ModuleDefinition module : modules) {
            ModuleDefinition existing = byName.putIfAbsent(module.name(), module);
            if (existing != null) {
                throw new LinkException("Duplicate module name '" + module.name()
                        + "' defined in multiple files: " + existing.file() + ", " + module.file()
                        + ". Each DSL file should declare a unique module name.");
            }
        }
        for (ModuleDefinition module : modules) {
            for (String used : module.usedModuleNames()) {
                if (!byName.containsKey(used)) {
                    throw new LinkException("Module '" + module.name() + "' depends on '" + used
                            + "', but '" + used + "' is not defined. Available modules: " + byName.keySet());
                }
            }
        }
    }

    // ==================== Reference validation ====================

    /**
     * Checks that every name used by a declaration resolves.
     *
     * @return One message per unresolved reference, empty when all resolve
     */
    public static List<String> validateReferences(SymbolTable symbols) {
        List<String> errors = new ArrayList<>();
        Map<String, EntityDefinition> entities = symbols.entities();

        for (EntityDefinition entity : entities.values()) {
            for (FieldDefinition field : entity.fields()) {
                if (field.type().kind().isEntityReference() && !entities.containsKey(field.type().refEntity())) {
                    errors.add("Entity '" + entity.name() + "' field '" + field.name()
                            + "' references unknown entity '" + field.type().refEntity() + "'");
                }
            }
            for (Constraint constraint : entity.constraints()) {
                for (String fieldName : constraint.fields()) {
                    if (entity.findField(fieldName).isEmpty()) {
                        errors.add("Entity '" + entity.name() + "' constraint references unknown field '"
                                + fieldName + "'");
                    }
                }
            }
            for (InvariantDefinition invariant : entity.invariants()) {
                checkPaths(entity, invariant.expression(), "invariant", errors);
            }
            for (ComputedField computed : entity.computedFields()) {
                checkPaths(entity, computed.expression(), "computed field '" + computed.name() + "'", errors);
            }
            if (entity.stateMachine() != null) {
                checkStateMachine(entity, entity.stateMachine(), errors);
            }
        }

        checkLlmReferences(symbols, errors);
        return errors;
    }

    private static void checkStateMachine(EntityDefinition entity, StateMachine machine, List<String> errors) {
        Set<String> states = new HashSet<>(machine.states());
        for (Transition transition : machine.transitions()) {
            String label = "transition '" + transition.fromState() + " -> " + transition.toState() + "'";
            if (!transition.isWildcard() && !states.contains(transition.fromState())) {
                errors.add("Entity '" + entity.name() + "' " + label + " uses unknown state '"
                        + transition.fromState() + "'");
            }
            if (!states.contains(transition.toState())) {
                errors.add("Entity '" + entity.name() + "' " + label + " uses unknown state '"
                        + transition.toState() + "'");
            }
            for (Guard guard : transition.guards()) {
                if (guard instanceof Guard.RequiresField requires && !entity.hasField(requires.field())) {
                    errors.add("Entity '" + entity.name() + "' " + label + " requires unknown field '"
                            + requires.field() + "'");
                } else if (guard instanceof Guard.ExpressionGuard expression) {
                    checkPaths(entity, expression.expression(), label + " guard", errors);
                }
            }
        }
    }

    private static void checkPaths(EntityDefinition entity, Expr expr, String where, List<String> errors) {
        Set<String> reported = new LinkedHashSet<>();
        for (FieldRef ref : FieldRefCollector.collect(expr)) {
            String field = ref.root();
            if (CONTEXT_ROOTS.contains(field)) {
                if (!field.equals("self") || ref.isSimple()) {
                    continue;
                }
                field = ref.path().get(1);
            }
            if (!entity.hasField(field) && reported.add(field)) {
                errors.add("Entity '" + entity.name() + "' " + where + " references unknown field '" + field + "'");
            }
        }
    }

    private static void checkLlmReferences(SymbolTable symbols, List<String> errors) {
        Map<String, LlmModelDefinition> models = symbols.llmModels();
        Optional<LlmConfigDefinition> config = symbols.llmConfig();
        String defaultModel = config.map(LlmConfigDefinition::defaultModel).orElse(null);

        for (LlmIntentDefinition intent : symbols.llmIntents().values()) {
            if (intent.modelRef() != null && !models.containsKey(intent.modelRef())) {
                errors.add("llm_intent '" + intent.name() + "' references unknown llm_model '"
                        + intent.modelRef() + "'");
            }
            if (intent.outputSchema() != null && !symbols.entities().containsKey(intent.outputSchema())) {
                errors.add("llm_intent '" + intent.name() + "' output_schema references unknown entity '"
                        + intent.outputSchema() + "'");
            }
        }

        if (config.isPresent()) {
            if (defaultModel != null && !models.containsKey(defaultModel)) {
                errors.add("llm_config default_model references unknown llm_model '" + defaultModel + "'");
            }
            for (String model : config.get().rateLimits().keySet()) {
                if (!models.containsKey(model)) {
                    errors.add("llm_config rate_limits references unknown llm_model '" + model + "'");
                }
            }
        }

        if (!symbols.llmIntents().isEmpty() && models.isEmpty()) {
            errors.add("llm_intent(s) defined but no llm_model(s) are available. "
                    + "Define at least one llm_model for intents to use.");
        } else {
            for (LlmIntentDefinition intent : symbols.llmIntents().values()) {
                if (intent.modelRef() == null && defaultModel == null) {
                    errors.add("llm_intent '" + intent.name() + "' has no model reference and no default_model "
                            + "is set in llm_config. Either specify model: in the intent or set default_model: "
                            + "in llm_config.");
                }
            }
        }
    }

    // ==================== Module access ====================

    /**
     * Checks that modules only reference entities from themselves or modules
     * they {@code use}.
     */
    public static List<String> validateModuleAccess(List<ModuleDefinition> modules, SymbolTable symbols) {
        List<String> errors = new ArrayList<>();
        for (ModuleDefinition module : modules) {
            Set<String> allowed = new HashSet<>(module.usedModuleNames());
            allowed.add(module.name());

            for (EntityDefinition entity : module.fragment().entities()) {
                for (FieldDefinition field : entity.fields()) {
                    if (!field.type().kind().isEntityReference()) {
                        continue;
                    }
                    String target = field.type().refEntity();
                    symbols.moduleOf(SymbolKind.ENTITY, target)
                            .filter(owner -> !allowed.contains(owner))
                            .ifPresent(owner -> errors.add("Module '" + module.name() + "' entity '"
                                    + entity.name() + "' field '" + field.name() + "' references entity '"
                                    + target + "' from module '" + owner + "' without importing it (add: use "
                                    + owner + ")"));
                }
            }
            for (LlmIntentDefinition intent : module.fragment().llmIntents()) {
                if (intent.outputSchema() == null) {
                    continue;
                }
                symbols.moduleOf(SymbolKind.ENTITY, intent.outputSchema())
                        .filter(owner -> !allowed.contains(owner))
                        .ifPresent(owner -> errors.add("Module '" + module.name() + "' llm_intent '"
                                + intent.name() + "' references entity '" + intent.outputSchema()
                                + "' from module '" + owner + "' without importing it (add: use " + owner + ")"));
            }
        }
        return errors;
    }

    // ==================== Warnings ====================

    /**
     * Reports {@code use} declarations whose module is never referenced.
     */
    public static List<String> checkUnusedImports(List<ModuleDefinition> modules, SymbolTable symbols) {
        List<String> warnings = new ArrayList<>();
        for (ModuleDefinition module : modules) {
            if (module.uses().isEmpty()) {
                continue;
            }
            Set<String> referenced = new HashSet<>();
            for (EntityDefinition entity : module.fragment().entities()) {
                for (FieldDefinition field : entity.fields()) {
                    if (field.type().kind().isEntityReference()) {
                        symbols.moduleOf(SymbolKind.ENTITY, field.type().refEntity()).ifPresent(referenced::add);
                    }
                }
            }
            for (LlmIntentDefinition intent : module.fragment().llmIntents()) {
                if (intent.outputSchema() != null) {
                    symbols.moduleOf(SymbolKind.ENTITY, intent.outputSchema()).ifPresent(referenced::add);
                }
                if (intent.modelRef() != null) {
                    symbols.moduleOf(SymbolKind.LLM_MODEL, intent.modelRef()).ifPresent(referenced::add);
                }
            }
            for (String unused : new TreeSet<>(module.usedModuleNames())) {
                if (!referenced.contains(unused)) {
                    warnings.add("Module '" + module.name() + "' imports '" + unused
                            + "' but never uses it. Consider removing: use " + unused);
                }
            }
        }
        return warnings;
    }

    /**
     * Reports cycles of required {@code ref} fields between entities. Optional
     * refs and self references are not followed; each cycle is reported once.
     */
    public static List<String> detectEntityCycles(SymbolTable symbols) {
        Map<String, Set<String>> graph = new LinkedHashMap<>();
        for (EntityDefinition entity : symbols.entities().values()) {
            Set<String> targets = new LinkedHashSet<>();
            for (FieldDefinition field : entity.fields()) {
                if (field.type().kind() != FieldTypeKind.REF || field.has(FieldModifier.OPTIONAL)) {
                    continue;
                }
                String target = field.type().refEntity();
                if (!target.equals(entity.name()) && symbols.entities().containsKey(target)) {
                    targets.add(target);
                }
            }
            graph.put(entity.name(), targets);
        }

        List<String> warnings = new ArrayList<>();
        Set<List<String>> reported = new HashSet<>();
        for (String start : graph.keySet()) {
            List<String> cycle = findCycle(start, graph, new HashSet<>(), new ArrayList<>());
            if (cycle == null || !reported.add(normalize(cycle))) {
                continue;
            }
            warnings.add("Circular entity reference detected: " + String.join(" -> ", cycle) + "\n"
                    + "  This may cause issues with database migrations and data loading.\n"
                    + "  Consider breaking the cycle with optional refs or a junction entity.");
        }
        return warnings;
    }

    private static List<String> findCycle(String node, Map<String, Set<String>> graph,
                                          Set<String> visited, List<String> path) {
        int index = path.indexOf(node);
        if (index >= 0) {
            List<String> cycle = new ArrayList<>(path.subList(index, path.size()));
            cycle.add(node);
            return cycle;
        }
        if (!visited.add(node)) {
            return null;
        }
        path.add(node);
        for (String next : graph.getOrDefault(node, Set.of())) {
            List<String> cycle = findCycle(next, graph, visited, path);
            if (cycle != null) {
                return cycle;
            }
        }
        path.remove(path.size() - 1);
        return null;
    }

    /**
     * Rotates a closed cycle so it starts at its smallest name.
     */
    private static List<String> normalize(List<String> cycle) {
        List<String> open = cycle.subList(0, cycle.size() - 1);
        int min = 0;
        for (int i = 1; i < open.size(); i++) {
            if (open.get(i).compareTo(open.get(min)) < 0) {
                min = i;
            }
        }
        List<String> rotated = new ArrayList<>(open.subList(min, open.size()));
        rotated.addAll(open.subList(0, min));
        return rotated;
    }

    /**
     * Field-name type conflicts across all linked entities.
     */
    public static List<String> fieldTypeConflicts(SymbolTable symbols) {
        return TypeCatalog.of(symbols.entities().values()).fieldTypeConflicts();
    }
}
