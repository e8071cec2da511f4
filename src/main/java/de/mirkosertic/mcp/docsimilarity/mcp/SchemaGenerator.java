package de.mirkosertic.mcp.docsimilarity.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives MCP tool input schemas from request records.
 * <p>
 * Every record component becomes a property; components not annotated with {@link Nullable}
 * are required. Lists become arrays, and records (top level, nested or as list items) become
 * objects with their own properties and required list.
 */
public final class SchemaGenerator {

    private SchemaGenerator() {
    }

    public static McpSchema.JsonSchema generateSchema(final Class<? extends Record> recordClass) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        final List<String> required = new ArrayList<>();
        collectProperties(recordClass, properties, required);
        return new McpSchema.JsonSchema("object", properties, required, null, null, null);
    }

    /**
     * Schema for tools without parameters.
     */
    public static McpSchema.JsonSchema emptySchema() {
        return new McpSchema.JsonSchema("object", Map.of(), List.of(), null, null, null);
    }

    private static void collectProperties(final Class<?> recordClass,
                                          final Map<String, Object> properties,
                                          final List<String> required) {
        for (final RecordComponent component : recordClass.getRecordComponents()) {
            final Map<String, Object> property = new LinkedHashMap<>();
            final Description description = component.getAnnotation(Description.class);
            if (description != null) {
                property.put("description", description.value());
            }
            addTypeSchema(property, component.getGenericType());
            properties.put(component.getName(), property);

            if (!isNullable(component)) {
                required.add(component.getName());
            }
        }
    }

    // jspecify's @Nullable is a type-use annotation, so it sits on the component's type
    private static boolean isNullable(final RecordComponent component) {
        return component.getAnnotatedType().isAnnotationPresent(Nullable.class);
    }

    private static void addTypeSchema(final Map<String, Object> schema, final Type type) {
        if (type instanceof ParameterizedType parameterized
                && parameterized.getRawType() instanceof Class<?> rawClass) {
            if (Collection.class.isAssignableFrom(rawClass)) {
                schema.put("type", "array");
                final Map<String, Object> items = new LinkedHashMap<>();
                addTypeSchema(items, parameterized.getActualTypeArguments()[0]);
                schema.put("items", items);
            } else if (Map.class.isAssignableFrom(rawClass)) {
                schema.put("type", "object");
                schema.put("additionalProperties", true);
            } else {
                schema.put("type", "object");
            }
            return;
        }

        if (!(type instanceof Class<?> clazz)) {
            schema.put("type", "string");
            return;
        }

        if (clazz == String.class) {
            schema.put("type", "string");
        } else if (clazz == Integer.class || clazz == int.class || clazz == Long.class || clazz == long.class) {
            schema.put("type", "integer");
        } else if (clazz == Double.class || clazz == double.class || clazz == Float.class || clazz == float.class) {
            schema.put("type", "number");
        } else if (clazz == Boolean.class || clazz == boolean.class) {
            schema.put("type", "boolean");
        } else if (clazz.isEnum()) {
            schema.put("type", "string");
            final List<String> names = new ArrayList<>();
            for (final Object constant : clazz.getEnumConstants()) {
                names.add(((Enum<?>) constant).name());
            }
            schema.put("enum", names);
        } else if (clazz.isRecord()) {
            schema.put("type", "object");
            final Map<String, Object> nestedProperties = new LinkedHashMap<>();
            final List<String> nestedRequired = new ArrayList<>();
            collectProperties(clazz, nestedProperties, nestedRequired);
            schema.put("properties", nestedProperties);
            if (!nestedRequired.isEmpty()) {
                schema.put("required", nestedRequired);
            }
        } else {
            schema.put("type", "object");
        }
    }
}
