package org.dazzle.engine.link;

import org.dazzle.dsl.definition.EntityDefinition;
import org.dazzle.dsl.definition.FieldDefinition;
import org.dazzle.dsl.definition.FieldType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Field name to every distinct type it is declared with across all entities.
 */
public final class TypeCatalog {

    private final Map<String, List<FieldType>> types = new LinkedHashMap<>();

    private TypeCatalog() {
    }

    public static TypeCatalog of(Collection<EntityDefinition> entities) {
        TypeCatalog catalog = new TypeCatalog();
        for (EntityDefinition entity : entities) {
            for (FieldDefinition field : entity.fields()) {
                List<FieldType> seen = catalog.types.computeIfAbsent(field.name(), k -> new ArrayList<>());
                if (!seen.contains(field.type())) {
                    seen.add(field.type());
                }
            }
        }
        return catalog;
    }

    public List<FieldType> typesOf(String fieldName) {
        return List.copyOf(types.getOrDefault(fieldName, List.of()));
    }

    public Map<String, List<FieldType>> asMap() {
        Map<String, List<FieldType>> copy = new LinkedHashMap<>();
        types.forEach((name, list) -> copy.put(name, List.copyOf(list)));
        return copy;
    }

    /**
     * Warns about field names declared with more than one type, e.g.
     * "Field 'title' has inconsistent types: str(100), str(200)".
     */
    public List<String> fieldTypeConflicts() {
        List<String> conflicts = new ArrayList<>();
        types.forEach((name, list) -> {
            if (list.size() > 1) {
                conflicts.add("Field '" + name + "' has inconsistent types: "
                        + list.stream().map(FieldType::describe).collect(Collectors.joining(", ")));
            }
        });
        return conflicts;
    }
}
