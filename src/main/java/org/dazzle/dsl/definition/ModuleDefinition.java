package org.dazzle.dsl.definition;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One parsed DSL source file.
 *
 * DSL syntax:
 *
 * <pre>
 * module billing.core
 * use crm.contacts
 * use shared.types as types
 * app invoicer "Invoicer"
 * </pre>
 *
 * @param name     The dotted module name
 * @param file     The source file identity, may be null for in-memory sources
 * @param uses     The modules this module declares it depends on
 * @param app      The app declaration, if this module carries one
 * @param fragment The constructs this module contributes
 */
public record ModuleDefinition(
        String name,
        String file,
        List<UseDeclaration> uses,
        AppDeclaration app,
        Fragment fragment) {

    public ModuleDefinition {
        Objects.requireNonNull(name, "Module name cannot be null");
        Objects.requireNonNull(fragment, "Fragment cannot be null");
        uses = uses == null ? List.of() : List.copyOf(uses);
    }

    public static ModuleDefinition of(String name, Fragment fragment, String... uses) {
        return new ModuleDefinition(name, null,
                Arrays.stream(uses).map(u -> new UseDeclaration(u, null)).toList(),
                null, fragment);
    }

    /**
     * @return The names of the modules listed in {@code use} declarations
     */
    public List<String> usedModuleNames() {
        return uses.stream().map(UseDeclaration::module).toList();
    }

    /**
     * @param module The used module name
     * @param alias  Optional local alias ({@code use x as y}), may be null
     */
    public record UseDeclaration(String module, String alias) {
        public UseDeclaration {
            Objects.requireNonNull(module, "Used module cannot be null");
        }
    }

    /**
     * @param name  The application name
     * @param title The display title, may be null
     */
    public record AppDeclaration(String name, String title) {
        public AppDeclaration {
            Objects.requireNonNull(name, "App name cannot be null");
        }
    }
}
