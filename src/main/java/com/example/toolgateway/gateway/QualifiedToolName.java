package com.example.toolgateway.gateway;

import com.example.toolgateway.exception.NameFormatException;

/**
 * A tool name of the form {@code "<kind>.<tool>"}, e.g. {@code "sql.list_tables"}.
 */
public record QualifiedToolName(String kind, String tool) {

    public static final char SEPARATOR = '.';

    /**
     * Parse a qualified name. Exactly one separator with a non-empty part on
     * each side is accepted.
     *
     * @throws NameFormatException for anything else
     */
    public static QualifiedToolName parse(String qualifiedName) {
        if (qualifiedName == null) {
            throw new NameFormatException(null);
        }
        int index = qualifiedName.indexOf(SEPARATOR);
        if (index <= 0 || index == qualifiedName.length() - 1
                || qualifiedName.indexOf(SEPARATOR, index + 1) >= 0) {
            throw new NameFormatException(qualifiedName);
        }
        return new QualifiedToolName(qualifiedName.substring(0, index), qualifiedName.substring(index + 1));
    }

    public static String of(String kind, String tool) {
        return kind + SEPARATOR + tool;
    }

    @Override
    public String toString() {
        return of(kind, tool);
    }
}
