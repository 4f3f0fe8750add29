package io.sqltx.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionStringTest {

    @Test
    void enlistDefaultsToTrue() {
        ConnectionString cs = ConnectionString.parse("jdbc:h2:mem:db;DB_CLOSE_DELAY=-1");

        assertTrue(cs.isEnlist());
        assertEquals("jdbc:h2:mem:db;DB_CLOSE_DELAY=-1", cs.jdbcUrl());
    }

    @Test
    void semicolonSettingIsParsedAndStripped() {
        ConnectionString cs = ConnectionString.parse("jdbc:h2:mem:db;Enlist=false;DB_CLOSE_DELAY=-1");

        assertFalse(cs.isEnlist());
        assertEquals("jdbc:h2:mem:db;DB_CLOSE_DELAY=-1", cs.jdbcUrl());
    }

    @Test
    void queryParameterIsParsedAndStripped() {
        ConnectionString cs = ConnectionString.parse("jdbc:postgresql://host/db?ssl=true&enlist=FALSE&loginTimeout=5");

        assertFalse(cs.isEnlist());
        assertEquals("jdbc:postgresql://host/db?ssl=true&loginTimeout=5", cs.jdbcUrl());
    }

    @Test
    void onlyQueryParameterLeavesNoQuestionMark() {
        ConnectionString cs = ConnectionString.parse("jdbc:mysql://host/db?ENLIST=true");

        assertTrue(cs.isEnlist());
        assertEquals("jdbc:mysql://host/db", cs.jdbcUrl());
    }

    @Test
    void keyIsCaseInsensitiveAndTrimmed() {
        assertFalse(ConnectionString.parse("jdbc:h2:mem:db; enlist = false").isEnlist());
    }

    @Test
    void invalidValueIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConnectionString.parse("jdbc:h2:mem:db;Enlist=maybe"));
        assertTrue(e.getMessage().contains("maybe"));
    }

    @Test
    void blankAndNullAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> ConnectionString.parse(" "));
        assertThrows(NullPointerException.class, () -> ConnectionString.parse(null));
    }
}
