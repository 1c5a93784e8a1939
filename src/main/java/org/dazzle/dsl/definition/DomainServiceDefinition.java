package org.dazzle.dsl.definition;

import java.util.List;
import java.util.Objects;

/**
 * A domain service declaration: a typed operation whose implementation is a
 * hand-written stub outside the DSL.
 *
 * DSL syntax:
 *
 * <pre>
 * service calculate_vat "Calculate VAT":
 *   kind: domain_logic
 *   input:
 *     invoice_id: uuid required
 *   output:
 *     vat_amount: decimal(10,2)
 *   guarantees:
 *     - "Must not mutate the invoice"
 *   stub: python
 * </pre>
 */
public record DomainServiceDefinition(
        String name,
        String title,
        Kind kind,
        List<ServiceField> inputs,
        List<ServiceField> outputs,
        List<String> guarantees,
        String stubLanguage) implements DslDefinition {

    public static final String DEFAULT_STUB_LANGUAGE = "python";

    public enum Kind {
        DOMAIN_LOGIC,
        VALIDATION,
        INTEGRATION,
        WORKFLOW;

        public static Kind fromDsl(String word) {
            for (Kind kind : values()) {
                if (kind.name().equalsIgnoreCase(word)) {
                    return kind;
                }
            }
            return null;
        }
    }

    /**
     * @param name     The parameter name
     * @param typeName The type as written, e.g. {@code decimal(10,2)}
     * @param required Whether the parameter is mandatory
     */
    public record ServiceField(String name, String typeName, boolean required) {
        public ServiceField {
            Objects.requireNonNull(name, "Name cannot be null");
            Objects.requireNonNull(typeName, "Type cannot be null");
        }
    }

    public DomainServiceDefinition {
        Objects.requireNonNull(name, "Service name cannot be null");
        kind = kind == null ? Kind.DOMAIN_LOGIC : kind;
        stubLanguage = stubLanguage == null ? DEFAULT_STUB_LANGUAGE : stubLanguage;
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        guarantees = guarantees == null ? List.of() : List.copyOf(guarantees);
    }
}
