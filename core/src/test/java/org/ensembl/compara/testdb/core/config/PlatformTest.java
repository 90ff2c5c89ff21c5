package org.ensembl.compara.testdb.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PlatformTest {

    @Test
    void of_shouldBeCaseInsensitive() {
        assertEquals(Platform.MYSQL, Platform.of("mysql"));
        assertEquals(Platform.SQLITE, Platform.of(" SQLite "));
    }

    @Test
    void of_shouldRejectUnknownName() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> Platform.of("oracle"));
        assertTrue(ex.getMessage().contains("oracle"));
    }

    @Test
    void requiresServer_shouldOnlyHoldForMysql() {
        assertTrue(Platform.MYSQL.requiresServer());
        assertFalse(Platform.SQLITE.requiresServer());
    }
}
