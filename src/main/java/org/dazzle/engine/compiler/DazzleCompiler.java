package org.dazzle.engine.compiler;

import org.dazzle.dsl.DslParseException;
import org.dazzle.dsl.DslParser;
import org.dazzle.dsl.definition.ModuleDefinition;
import org.dazzle.dsl.validation.AntiTuringValidator;
import org.dazzle.dsl.validation.Violation;
import org.dazzle.engine.link.AppSpec;
import org.dazzle.engine.link.LinkException;
import org.dazzle.engine.link.Linker;
import org.dazzle.engine.link.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Front door of the DSL tool chain: source text in, linked {@link AppSpec} out.
 *
 * Pipeline per compilation:
 * 1. anti-Turing check of each source (when enabled)
 * 2. parse each source into a module
 * 3. build the symbol table (duplicates are fatal)
 * 4. validate references and module access
 * 5. collect warnings: unused imports, entity cycles, field type conflicts
 *
 * Problems are reported in the {@link CompilationResult}; nothing is thrown
 * for bad input.
 */
public final class DazzleCompiler {

    private static final Logger log = LoggerFactory.getLogger(DazzleCompiler.class);

    private final CompilerOptions options;

    public DazzleCompiler() {
        this(CompilerOptions.defaults());
    }

    public DazzleCompiler(CompilerOptions options) {
        this.options = Objects.requireNonNull(options, "Options cannot be null");
    }

    public CompilerOptions options() {
        return options;
    }

    /**
     * Compiles named sources. Modules are linked in the map's iteration order.
     *
     * @param sources File name to DSL source text
     */
    public CompilationResult compileSources(Map<String, String> sources) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<Violation> violations = new ArrayList<>();
        List<ModuleDefinition> modules = new ArrayList<>();

        for (Map.Entry<String, String> source : sources.entrySet()) {
            String file = source.getKey();
            if (options.antiTuring()) {
                for (Violation violation : AntiTuringValidator.validate(source.getValue())) {
                    violations.add(violation);
                    String message = file + ":" + violation.line() + ":" + violation.column() + " "
                            + violation.message();
                    if (violation.isBlocking(options.strict())) {
                        errors.add(message);
                    } else {
                        warnings.add(message);
                    }
                }
            }
            try {
                modules.add(DslParser.parse(source.getValue(), file));
            } catch (DslParseException e) {
                errors.add(e.getMessage());
            }
        }

        if (options.failOnWarnings()) {
            errors.addAll(warnings);
        }
        if (!errors.isEmpty()) {
            return fail(errors, warnings, violations);
        }
        CompilationResult linked = compile(modules);
        warnings.addAll(linked.warnings());
        return new CompilationResult(linked.app(), linked.errors(), warnings, violations);
    }

    /**
     * Links already parsed modules.
     */
    public CompilationResult compile(List<ModuleDefinition> modules) {
        List<String> warnings = new ArrayList<>();
        SymbolTable symbols;
        try {
            symbols = Linker.buildSymbolTable(modules);
        } catch (LinkException e) {
            return fail(List.of(e.getMessage()), warnings, List.of());
        }

        List<String> errors = new ArrayList<>(Linker.validateReferences(symbols));
        errors.addAll(Linker.validateModuleAccess(modules, symbols));

        warnings.addAll(Linker.checkUnusedImports(modules, symbols));
        warnings.addAll(Linker.detectEntityCycles(symbols));
        warnings.addAll(Linker.fieldTypeConflicts(symbols));

        if (options.failOnWarnings()) {
            errors.addAll(warnings);
        }
        if (!errors.isEmpty()) {
            return fail(errors, warnings, List.of());
        }

        AppSpec app = Linker.link(modules, symbols);
        log.info("Compiled app '{}': {} module(s), {} entities, {} warning(s)",
                app.name(), modules.size(), app.entities().size(), warnings.size());
        return new CompilationResult(app, List.of(), warnings, List.of());
    }

    private static CompilationResult fail(List<String> errors, List<String> warnings, List<Violation> violations) {
        for (String error : errors) {
            log.warn("Compilation error: {}", error);
        }
        return CompilationResult.failure(errors, warnings, violations);
    }
}
