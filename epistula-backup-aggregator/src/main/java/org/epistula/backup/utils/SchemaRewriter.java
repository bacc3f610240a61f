package org.epistula.backup.utils;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Retargets a plain SQL dump of one schema at another schema.
 * <p>
 * Rewritten spellings: {@code " <schema>."}, {@code " <schema>;"}, the quoted identifier {@code "<schema>"}
 * and the qualified name at the start of a string literal, {@code '<schema>.}, which is how pg_dump writes
 * sequence references in {@code nextval} defaults and {@code setval} calls. References at the very start of a
 * line, unquoted references followed by other punctuation and references inside function bodies are left alone.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class SchemaRewriter {

    public static String rewrite(String sql, String sourceSchema, String targetSchema) {
        SchemaNames.validate(sourceSchema);
        SchemaNames.validate(targetSchema);
        if (sourceSchema.equals(targetSchema)) {
            return sql;
        }
        return sql
                .replace(" " + sourceSchema + ".", " " + targetSchema + ".")
                .replace(" " + sourceSchema + ";", " " + targetSchema + ";")
                .replace("\"" + sourceSchema + "\"", "\"" + targetSchema + "\"")
                .replace("'" + sourceSchema + ".", "'" + targetSchema + ".");
    }
}
