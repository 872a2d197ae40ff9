package com.mendwatch.core.model;

import java.io.Serializable;

/**
 * One edit applied by a fix.
 *
 * @param type    kind of edit, e.g. "replace", "insert", "delete"
 * @param oldText text before the edit (empty for inserts)
 * @param newText text after the edit (empty for deletes)
 */
public record Change(
    String type,
    String oldText,
    String newText
) implements Serializable {}
