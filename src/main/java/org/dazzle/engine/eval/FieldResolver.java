package org.dazzle.engine.eval;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.List;
import java.util.Map;

/**
 * Walks a field path through a context made of maps, records and beans.
 *
 * Maps are looked up by key. Anything else falls back to attribute access:
 * record component, then {@code getX()}/{@code isX()}, then a public field.
 * A missing segment anywhere yields null for the whole path.
 */
final class FieldResolver {

    static final String SELF = "self";

    private FieldResolver() {
    }

    static Object resolve(Map<String, ?> context, List<String> path) {
        Object current = context;
        int start = 0;
        // "self" addresses the record in scope when the caller did not nest it
        if (path.get(0).equals(SELF) && !context.containsKey(SELF)) {
            start = 1;
        }
        for (int i = start; i < path.size(); i++) {
            if (current == null) {
                return null;
            }
            current = segment(current, path.get(i));
        }
        return current;
    }

    private static Object segment(Object target, String name) {
        if (target instanceof Map<?, ?> map) {
            return map.get(name);
        }
        return attribute(target, name);
    }

    private static Object attribute(Object target, String name) {
        Class<?> type = target.getClass();
        try {
            if (type.isRecord()) {
                for (RecordComponent component : type.getRecordComponents()) {
                    if (component.getName().equals(name)) {
                        return component.getAccessor().invoke(target);
                    }
                }
                return null;
            }
            String suffix = Character.toUpperCase(name.charAt(0)) + name.substring(1);
            for (String candidate : List.of("get" + suffix, "is" + suffix)) {
                Method getter = findPublicMethod(type, candidate);
                if (getter != null) {
                    return getter.invoke(target);
                }
            }
            Field field = type.getField(name);
            return Modifier.isStatic(field.getModifiers()) ? null : field.get(target);
        } catch (NoSuchFieldException e) {
            return null;
        } catch (ReflectiveOperationException | SecurityException e) {
            throw new EvaluationException("Cannot read attribute '" + name + "' of " + type.getSimpleName(), e);
        }
    }

    private static Method findPublicMethod(Class<?> type, String name) {
        try {
            Method method = type.getMethod(name);
            return Modifier.isStatic(method.getModifiers()) ? null : method;
        } catch (NoSuchMethodException e) {
            return null;
        }
    }
}
