package com.mailmind.store.jdbc;

import com.mailmind.config.ClassifierConfig;
import com.mailmind.exception.StoreException;
import com.mailmind.priority.BaseClassification;
import com.mailmind.priority.DefaultPriorityClassifier;
import com.mailmind.priority.MessageRef;
import com.mailmind.priority.Priority;
import com.mailmind.priority.SenderProfile;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JdbcPreferenceStore on H2.
 */
class JdbcPreferenceStoreTest {

    private JdbcDataSource dataSource;
    private JdbcPreferenceStore store;

    @BeforeEach
    void setUp() {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:mailmind_pref_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        store = new JdbcPreferenceStore(dataSource);
        store.createSchema();
    }

    @Test
    @DisplayName("Should insert then update a preference")
    void shouldUpsert() {
        assertTrue(store.get("theme").isEmpty());

        store.set("theme", "dark");
        assertEquals("dark", store.get("theme").orElseThrow());

        store.set("theme", "light");
        assertEquals("light", store.get("theme").orElseThrow());
    }

    @Test
    @DisplayName("Should create the schema idempotently")
    void shouldCreateSchemaTwice() {
        store.set("k", "v");
        store.createSchema();

        assertEquals("v", store.get("k").orElseThrow());
    }

    @Test
    @DisplayName("Should reject unsafe table names")
    void shouldRejectUnsafeTableName() {
        assertThrows(IllegalArgumentException.class,
                () -> new JdbcPreferenceStore(dataSource, "prefs; DROP TABLE x"));
    }

    @Test
    @DisplayName("Should wrap SQL failures in StoreException")
    void shouldWrapSqlFailures() {
        JdbcPreferenceStore missingTable = new JdbcPreferenceStore(dataSource, "not_created");

        assertThrows(StoreException.class, () -> missingTable.get("k"));
    }

    @Test
    @DisplayName("Should keep learned sender profiles across classifier restarts")
    void shouldPersistSenderProfiles() {
        JdbcClassificationLog log = new JdbcClassificationLog(dataSource);
        log.createSchema();

        DefaultPriorityClassifier first = new DefaultPriorityClassifier(store, log, ClassifierConfig.defaults());
        first.classifyPriority(new MessageRef("m-1", "grace@example.com"), BaseClassification.neutral());
        first.recordUserOverride("m-1", "grace@example.com", Priority.MEDIUM, 0.5, Priority.HIGH, "vip sender");
        first.setSenderVip("grace@example.com", true);
        first.close();

        DefaultPriorityClassifier second = new DefaultPriorityClassifier(store, log, ClassifierConfig.defaults());
        SenderProfile profile = second.getSenderStats("grace@example.com").orElseThrow();

        assertEquals(0.6, profile.importance(), 1e-9);
        assertEquals(1, profile.correctionCount());
        assertEquals(1, profile.emailCount());
        assertTrue(profile.vip());
    }
}
