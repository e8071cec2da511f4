package de.mirkosertic.mcp.docsimilarity.service;

import org.jspecify.annotations.Nullable;

/**
 * A raw text submitted for sentence analysis together with the name it is reported under.
 */
public record LabeledText(@Nullable String label, String text) {
}
