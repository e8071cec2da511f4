package de.mirkosertic.mcp.docsimilarity.mcp;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Human-readable text for a tool parameter. {@link SchemaGenerator} copies it into the
 * {@code description} of the generated JSON schema property.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface Description {
    String value();
}
