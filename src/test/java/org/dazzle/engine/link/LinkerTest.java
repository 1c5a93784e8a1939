package org.dazzle.engine.link;

import org.dazzle.dsl.DslParser;
import org.dazzle.dsl.definition.EntityDefinition;
import org.dazzle.dsl.definition.FieldDefinition;
import org.dazzle.dsl.definition.FieldType;
import org.dazzle.dsl.definition.Fragment;
import org.dazzle.dsl.definition.ModuleDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LinkerTest {

    private static ModuleDefinition module(String source, String file) {
        return DslParser.parse(source, file);
    }

    private static final ModuleDefinition CRM = module("""
            module crm
            entity Customer:
              id: uuid pk
              name: str(100) required
            """, "crm.dsl");

    @Nested
    @DisplayName("Symbol table")
    class Symbols {

        @Test
        @DisplayName("Same entity in two modules names both modules")
        void testDuplicateEntityAcrossModules() {
            ModuleDefinition billing = module("""
                    module billing
                    entity Customer:
                      id: uuid pk
                    """, "billing.dsl");

            LinkException e = assertThrows(LinkException.class, () -> Linker.buildSymbolTable(List.of(CRM, billing)));

            assertEquals("Duplicate entity 'Customer' defined in modules 'crm' and 'billing'", e.getMessage());
        }

        @Test
        @DisplayName("Same module name in two files names both files")
        void testDuplicateModuleName() {
            ModuleDefinition again = module("module crm\n", "crm_copy.dsl");

            LinkException e = assertThrows(LinkException.class, () -> Linker.buildSymbolTable(List.of(CRM, again)));

            assertTrue(e.getMessage().startsWith(
                    "Duplicate module name 'crm' defined in multiple files: crm.dsl, crm_copy.dsl."));
        }

        @Test
        @DisplayName("use of an undefined module is fatal")
        void testMissingUseTarget() {
            ModuleDefinition orders = module("module orders\nuse inventory\n", "orders.dsl");

            LinkException e = assertThrows(LinkException.class, () -> Linker.buildSymbolTable(List.of(CRM, orders)));

            assertTrue(e.getMessage().startsWith("Module 'orders' depends on 'inventory', but 'inventory' is not defined."));
            assertTrue(e.getMessage().contains("[crm, orders]"));
        }

        @Test
        @DisplayName("Second llm_config across modules is fatal")
        void testDuplicateLlmConfig() {
            ModuleDefinition a = module("module a\nllm_config:\n  artifact_store: local\n", "a.dsl");
            ModuleDefinition b = module("module b\nllm_config:\n  artifact_store: s3\n", "b.dsl");

            LinkException e = assertThrows(LinkException.class, () -> Linker.buildSymbolTable(List.of(a, b)));

            assertTrue(e.getMessage().contains("Only one llm_config block is allowed per app"));
        }

        @Test
        @DisplayName("Symbols remember their defining module")
        void testModuleOf() {
            SymbolTable symbols = Linker.buildSymbolTable(List.of(CRM));

            assertEquals("crm", symbols.moduleOf(SymbolKind.ENTITY, "Customer").orElseThrow());
            assertTrue(symbols.moduleOf(SymbolKind.SERVICE, "Customer").isEmpty());
            assertEquals(1, symbols.size());
        }
    }

    @Nested
    @DisplayName("Module access")
    class ModuleAccess {

        private final ModuleDefinition orders = module("""
                module orders
                entity Order:
                  id: uuid pk
                  customer: ref Customer required
                """, "orders.dsl");

        @Test
        @DisplayName("Reference into another module without use is reported")
        void testMissingUse() {
            List<ModuleDefinition> modules = List.of(CRM, orders);
            SymbolTable symbols = Linker.buildSymbolTable(modules);

            List<String> errors = Linker.validateModuleAccess(modules, symbols);

            assertEquals(List.of("Module 'orders' entity 'Order' field 'customer' references entity 'Customer' "
                    + "from module 'crm' without importing it (add: use crm)"), errors);
        }

        @Test
        @DisplayName("Reference with use is allowed and the import counts as used")
        void testWithUse() {
            ModuleDefinition importing = module("""
                    module orders
                    use crm
                    entity Order:
                      id: uuid pk
                      customer: ref Customer required
                    """, "orders.dsl");
            List<ModuleDefinition> modules = List.of(CRM, importing);
            SymbolTable symbols = Linker.buildSymbolTable(modules);

            assertTrue(Linker.validateModuleAccess(modules, symbols).isEmpty());
            assertTrue(Linker.checkUnusedImports(modules, symbols).isEmpty());
        }

        @Test
        @DisplayName("Unused import is a warning")
        void testUnusedImport() {
            ModuleDefinition reports = module("module reports\nuse crm\n", "reports.dsl");
            List<ModuleDefinition> modules = List.of(CRM, reports);

            List<String> warnings = Linker.checkUnusedImports(modules, Linker.buildSymbolTable(modules));

            assertEquals(List.of("Module 'reports' imports 'crm' but never uses it. Consider removing: use crm"),
                    warnings);
        }
    }

    @Nested
    @DisplayName("Reference validation")
    class References {

        private List<String> errorsFor(String source) {
            return Linker.validateReferences(Linker.buildSymbolTable(List.of(module(source, "app.dsl"))));
        }

        @Test
        @DisplayName("Reference to an unknown entity")
        void testUnknownEntity() {
            List<String> errors = errorsFor("""
                    entity Order:
                      id: uuid pk
                      customer: ref Customer
                    """);

            assertEquals(List.of("Entity 'Order' field 'customer' references unknown entity 'Customer'"), errors);
        }

        @Test
        @DisplayName("Unknown fields in invariants, computed fields and constraints")
        void testUnknownFields() {
            List<String> errors = errorsFor("""
                    entity Booking:
                      id: uuid pk
                      end_date: date
                      nights: computed days_since(check_in)
                      unique: reference
                      invariant: end_date > start_date
                    """);

            assertEquals(List.of(
                    "Entity 'Booking' constraint references unknown field 'reference'",
                    "Entity 'Booking' invariant references unknown field 'start_date'",
                    "Entity 'Booking' computed field 'nights' references unknown field 'check_in'"), errors);
        }

        @Test
        @DisplayName("Transition states, requires fields and guard paths are checked")
        void testTransitionReferences() {
            List<String> errors = errorsFor("""
                    entity Deal:
                      id: uuid pk
                      status: enum[draft,signed]
                      signatory: ref Deal
                      transitions:
                        draft -> archived: requires approver
                        draft -> signed:
                          guard: self->signatory->aml_status == "completed" and current_user != null
                        * -> draft:
                          guard: self->owner->active
                    """);

            assertEquals(List.of(
                    "Entity 'Deal' transition 'draft -> archived' uses unknown state 'archived'",
                    "Entity 'Deal' transition 'draft -> archived' requires unknown field 'approver'",
                    "Entity 'Deal' transition '* -> draft' guard references unknown field 'owner'"), errors);
        }

        @Test
        @DisplayName("Intent references to models and schemas")
        void testLlmReferences() {
            List<String> errors = errorsFor("""
                    llm_model fast:
                      provider: openai
                      model_id: "gpt-4o-mini"

                    llm_intent triage:
                      model: slow
                      prompt: "Triage"
                      output_schema: Ticket

                    llm_intent summarize:
                      prompt: "Summarize"

                    llm_config:
                      default_model: fastest
                      rate_limits:
                        fast: 60
                        other: 10
                    """);

            assertEquals(List.of(
                    "llm_intent 'triage' references unknown llm_model 'slow'",
                    "llm_intent 'triage' output_schema references unknown entity 'Ticket'",
                    "llm_config default_model references unknown llm_model 'fastest'",
                    "llm_config rate_limits references unknown llm_model 'other'"), errors);
        }

        @Test
        @DisplayName("Intent without model needs a default")
        void testIntentWithoutModel() {
            List<String> errors = errorsFor("""
                    llm_model fast:
                      provider: local
                      model_id: "llama"
                    llm_intent summarize:
                      prompt: "Summarize"
                    """);

            assertEquals(1, errors.size());
            assertTrue(errors.get(0).startsWith("llm_intent 'summarize' has no model reference and no default_model"));
        }

        @Test
        @DisplayName("Intents with no models at all")
        void testIntentsWithoutModels() {
            List<String> errors = errorsFor("llm_intent summarize:\n  prompt: \"Summarize\"\n");

            assertEquals(List.of("llm_intent(s) defined but no llm_model(s) are available. "
                    + "Define at least one llm_model for intents to use."), errors);
        }
    }

    @Nested
    @DisplayName("Warnings")
    class Warnings {

        @Test
        @DisplayName("Required ref cycle is reported once")
        void testEntityCycle() {
            ModuleDefinition module = module("""
                    entity Author:
                      id: uuid pk
                      latest: ref Book required
                    entity Book:
                      id: uuid pk
                      author: ref Author required
                    """, "lib.dsl");

            List<String> warnings = Linker.detectEntityCycles(Linker.buildSymbolTable(List.of(module)));

            assertEquals(1, warnings.size());
            assertTrue(warnings.get(0).startsWith("Circular entity reference detected: Author -> Book -> Author"));
        }

        @Test
        @DisplayName("Optional refs and self references break cycles")
        void testOptionalRefNoCycle() {
            ModuleDefinition module = module("""
                    entity Author:
                      id: uuid pk
                      latest: ref Book optional
                      mentor: ref Author
                    entity Book:
                      id: uuid pk
                      author: ref Author required
                    """, "lib.dsl");

            assertTrue(Linker.detectEntityCycles(Linker.buildSymbolTable(List.of(module))).isEmpty());
        }

        @Test
        @DisplayName("Same field name with different types")
        void testFieldTypeConflict() {
            EntityDefinition a = EntityDefinition.of("A", FieldDefinition.of("title", FieldType.str(100)));
            EntityDefinition b = EntityDefinition.of("B", FieldDefinition.of("title", FieldType.str(200)));
            EntityDefinition c = EntityDefinition.of("C", FieldDefinition.of("title", FieldType.str(100)));
            SymbolTable symbols = Linker.buildSymbolTable(List.of(ModuleDefinition.of("m", Fragment.ofEntities(a, b, c))));

            assertEquals(List.of("Field 'title' has inconsistent types: str(100), str(200)"),
                    Linker.fieldTypeConflicts(symbols));
            assertEquals(2, TypeCatalog.of(symbols.entities().values()).typesOf("title").size());
        }
    }

    @Nested
    @DisplayName("Linking")
    class Linking {

        @Test
        @DisplayName("App name comes from the first app declaration")
        void testAppDeclaration() {
            ModuleDefinition shop = module("""
                    module shop
                    use crm
                    app storefront "Store Front"
                    entity Cart:
                      id: uuid pk
                      owner: ref Customer
                    vocabulary:
                      cart: "Items a customer intends to buy"
                    """, "shop.dsl");

            AppSpec app = Linker.link(List.of(CRM, shop));

            assertEquals("storefront", app.name());
            assertEquals("Store Front", app.title());
            assertEquals(List.of("crm", "shop"), app.modules());
            assertEquals(List.of("Customer", "Cart"), app.entities().stream().map(EntityDefinition::name).toList());
            assertTrue(app.findEntity("Cart").isPresent());
            assertEquals(1, app.vocabulary().size());
            assertNull(app.llmConfig());
        }

        @Test
        @DisplayName("Without an app declaration the first module names the app")
        void testDefaultAppName() {
            assertEquals("crm", Linker.link(List.of(CRM)).name());
            assertEquals("app", Linker.link(List.of()).name());
        }
    }
}
