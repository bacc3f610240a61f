package org.epistula.backup.utils;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.epistula.backup.exceptions.InvalidSchemaNameException;

import java.util.regex.Pattern;

/**
 * Naming rules for tenant schemas. Every identifier that reaches DDL goes through {@link #validate(String)}
 * because schema names cannot be bound as statement parameters.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class SchemaNames {

    public static final String TEMP_SUFFIX = "_temp";
    public static final String OLD_SUFFIX = "_old";

    private static final int MAX_IDENTIFIER_LENGTH = 63;
    private static final Pattern IDENTIFIER = Pattern.compile("^[a-z_][a-z0-9_]*$");

    public static String validate(String schema) {
        if (schema == null || schema.isEmpty()) {
            throw new InvalidSchemaNameException(String.valueOf(schema), "identifier is empty");
        }
        if (schema.length() > MAX_IDENTIFIER_LENGTH) {
            throw new InvalidSchemaNameException(schema, "identifier is longer than " + MAX_IDENTIFIER_LENGTH + " characters");
        }
        if (!IDENTIFIER.matcher(schema).matches()) {
            throw new InvalidSchemaNameException(schema, "only lowercase letters, digits and underscores are allowed");
        }
        return schema;
    }

    public static String tempOf(String productionSchema) {
        return validate(productionSchema + TEMP_SUFFIX);
    }

    public static String oldOf(String productionSchema) {
        return validate(productionSchema + OLD_SUFFIX);
    }

    public static boolean isTemp(String schema) {
        return schema != null && schema.endsWith(TEMP_SUFFIX) && schema.length() > TEMP_SUFFIX.length();
    }

    public static String quote(String schema) {
        return "\"" + validate(schema) + "\"";
    }
}
