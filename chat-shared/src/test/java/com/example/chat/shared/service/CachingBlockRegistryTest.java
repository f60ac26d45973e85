package com.example.chat.shared.service;

import com.example.chat.shared.exception.PersistenceFailureException;
import com.example.chat.shared.model.Block;
import com.example.chat.shared.repository.BlockRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

final class CachingBlockRegistryTest {

    private EmbeddedDatabase database;
    private Cache<String, Boolean> cache;
    private CachingBlockRegistry registry;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("classpath:schema.sql")
                .build();
        cache = Caffeine.newBuilder().build();
        registry = new CachingBlockRegistry(new BlockRepository(new JdbcTemplate(database)), cache);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void blockIsEnforcedInBothDirections() {
        assertThat(registry.add("alice", "bob")).isTrue();

        assertThat(registry.isBlocked("alice", "bob")).isTrue();
        assertThat(registry.isBlocked("bob", "alice")).isTrue();
        assertThat(registry.isBlocked("alice", "carol")).isFalse();
    }

    @Test
    void addAndRemoveAreIdempotent() {
        assertThat(registry.add("alice", "bob")).isTrue();
        assertThat(registry.add("alice", "bob")).isFalse();

        assertThat(registry.remove("alice", "bob")).isTrue();
        assertThat(registry.remove("alice", "bob")).isFalse();
        assertThat(registry.isBlocked("alice", "bob")).isFalse();
    }

    @Test
    void cachedNegativeLookupIsInvalidatedByAdd() {
        assertThat(registry.isBlocked("alice", "bob")).isFalse();
        assertThat(cache.getIfPresent("alice|bob")).isFalse();

        registry.add("alice", "bob");

        assertThat(registry.isBlocked("bob", "alice")).isTrue();
    }

    @Test
    void removingOneDirectionKeepsTheOther() {
        registry.add("alice", "bob");
        registry.add("bob", "alice");

        registry.remove("alice", "bob");

        assertThat(registry.isBlocked("alice", "bob")).isTrue();
        assertThat(registry.blockedBy("bob")).extracting(Block::getBlockedId).containsExactly("alice");
        assertThat(registry.blockedBy("alice")).isEmpty();
    }

    @Test
    void selfBlockIsRejected() {
        assertThatThrownBy(() -> registry.add("alice", "alice")).isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.isBlocked("alice", "alice")).isFalse();
    }

    @Test
    void lookupFailuresSurfaceAsPersistenceFailures() {
        BlockRepository failing = mock(BlockRepository.class);
        when(failing.exists(anyString(), anyString())).thenThrow(new DataAccessResourceFailureException("pool exhausted"));
        when(failing.findByBlocker(anyString())).thenThrow(new DataAccessResourceFailureException("pool exhausted"));
        CachingBlockRegistry failingRegistry = new CachingBlockRegistry(failing, Caffeine.newBuilder().<String, Boolean>build());

        assertThatThrownBy(() -> failingRegistry.isBlocked("alice", "bob"))
                .isInstanceOf(PersistenceFailureException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
        assertThatThrownBy(() -> failingRegistry.blockedBy("alice"))
                .isInstanceOf(PersistenceFailureException.class);
    }
}
