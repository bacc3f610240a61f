package org.epistula.backup.utils;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class SchemaRewriterTest {

    @Test
    void rewritesQualifiedNamesSearchPathAndQuotedIdentifiers() {
        String sql = "CREATE SCHEMA uni_5;\n"
                + "SET search_path = uni_5;\n"
                + "CREATE TABLE uni_5.users (id integer);\n"
                + "ALTER TABLE ONLY \"uni_5\".users ADD PRIMARY KEY (id);\n";

        String rewritten = SchemaRewriter.rewrite(sql, "uni_5", "uni_5_temp");

        assertEquals("CREATE SCHEMA uni_5_temp;\n"
                + "SET search_path = uni_5_temp;\n"
                + "CREATE TABLE uni_5_temp.users (id integer);\n"
                + "ALTER TABLE ONLY \"uni_5_temp\".users ADD PRIMARY KEY (id);\n", rewritten);
    }

    @Test
    void leavesOtherSpellingsAlone() {
        String sql = "ALTER SCHEMA uni_5 OWNER TO epistula;\nuni_5.users\nSELECT 'uni_5,x';\n";

        assertEquals(sql, SchemaRewriter.rewrite(sql, "uni_5", "uni_5_temp"));
    }

    @Test
    void doesNotTouchSchemasSharingAPrefix() {
        String sql = "CREATE TABLE uni_50.users (id integer);";

        assertEquals(sql, SchemaRewriter.rewrite(sql, "uni_5", "uni_5_temp"));
    }

    @Test
    void retargetsDataAndConstraintStatements() {
        String sql = "INSERT INTO uni_5.faculties (id, name) VALUES (1, 'Law');\n"
                + "ALTER TABLE uni_5.subjects ADD CONSTRAINT fk FOREIGN KEY (faculty_id) REFERENCES uni_5.faculties(id);\n"
                + "COPY \"uni_5\".\"lectures\" (id) FROM stdin;\n";

        String rewritten = SchemaRewriter.rewrite(sql, "uni_5", "uni_5_temp");

        assertFalse(rewritten.contains(" uni_5."));
        assertFalse(rewritten.contains("\"uni_5\""));
        assertTrue(rewritten.contains("INSERT INTO uni_5_temp.faculties"));
        assertTrue(rewritten.contains("ALTER TABLE uni_5_temp.subjects"));
        assertTrue(rewritten.contains("REFERENCES uni_5_temp.faculties(id)"));
        assertTrue(rewritten.contains("\"uni_5_temp\".\"lectures\""));
    }

    @Test
    void retargetsSequenceLiteralsWrittenByPgDump() {
        String sql = "CREATE SEQUENCE uni_5.faculties_id_seq\n"
                + "ALTER SEQUENCE uni_5.faculties_id_seq OWNED BY uni_5.faculties.id;\n"
                + "ALTER TABLE ONLY uni_5.faculties ALTER COLUMN id SET DEFAULT nextval('uni_5.faculties_id_seq'::regclass);\n"
                + "SELECT pg_catalog.setval('uni_5.faculties_id_seq', 3, true);\n";

        String rewritten = SchemaRewriter.rewrite(sql, "uni_5", "uni_5_temp");

        assertEquals("CREATE SEQUENCE uni_5_temp.faculties_id_seq\n"
                + "ALTER SEQUENCE uni_5_temp.faculties_id_seq OWNED BY uni_5_temp.faculties.id;\n"
                + "ALTER TABLE ONLY uni_5_temp.faculties ALTER COLUMN id SET DEFAULT nextval('uni_5_temp.faculties_id_seq'::regclass);\n"
                + "SELECT pg_catalog.setval('uni_5_temp.faculties_id_seq', 3, true);\n", rewritten);
        assertFalse(rewritten.contains("'uni_5."));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "CREATE TABLE uni_51.users (id integer);",
            "CREATE TABLE public.uni_5_audit (id integer);",
            "SELECT * FROM \"uni_55\".users;",
            "GRANT USAGE ON SCHEMA uni_50 TO reader;",
            "CREATE TABLE tenant_uni_5.users (id integer);",
            "SELECT pg_catalog.setval('uni_50.users_id_seq', 1, false);"
    })
    void leavesOtherSchemasUntouched(String statement) {
        assertEquals(statement, SchemaRewriter.rewrite(statement, "uni_5", "uni_5_temp"));
    }

    @Test
    void sameSourceAndTargetIsIdentity() {
        String sql = "CREATE TABLE uni_5.users (id integer);";

        assertSame(sql, SchemaRewriter.rewrite(sql, "uni_5", "uni_5"));
    }
}
