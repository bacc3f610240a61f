package org.epistula.backup.utils;

import org.epistula.backup.exceptions.InvalidSchemaNameException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SchemaNamesTest {

    @Test
    void derivesCompanionSchemas() {
        assertEquals("uni_5_temp", SchemaNames.tempOf("uni_5"));
        assertEquals("uni_5_old", SchemaNames.oldOf("uni_5"));
        assertTrue(SchemaNames.isTemp("uni_5_temp"));
        assertFalse(SchemaNames.isTemp("uni_5"));
        assertFalse(SchemaNames.isTemp("_temp"));
    }

    @Test
    void quotesValidatedIdentifiers() {
        assertEquals("\"uni_5\"", SchemaNames.quote("uni_5"));
    }

    @Test
    void rejectsIdentifiersThatCouldInjectSql() {
        assertThrows(InvalidSchemaNameException.class, () -> SchemaNames.validate("uni_5\"; DROP SCHEMA public; --"));
        assertThrows(InvalidSchemaNameException.class, () -> SchemaNames.validate("Uni_5"));
        assertThrows(InvalidSchemaNameException.class, () -> SchemaNames.validate("5uni"));
        assertThrows(InvalidSchemaNameException.class, () -> SchemaNames.validate(""));
        assertThrows(InvalidSchemaNameException.class, () -> SchemaNames.validate(null));
        assertThrows(InvalidSchemaNameException.class, () -> SchemaNames.validate("u".repeat(64)));
    }
}
