package com.sqlitesession.test.infrastructure;

import com.sqlitesession.domain.session.model.entity.SessionAgentEntity;
import com.sqlitesession.domain.session.model.entity.SessionEntity;
import com.sqlitesession.domain.session.model.entity.SessionMessageEntity;
import com.sqlitesession.infrastructure.repository.session.SessionRepositoryImpl;
import com.sqlitesession.infrastructure.sqlite.SessionStoreLocation;
import com.sqlitesession.infrastructure.util.JsonCodec;
import com.sqlitesession.types.enums.EntityKindEnum;
import com.sqlitesession.types.enums.MessageRoleEnum;
import com.sqlitesession.types.enums.ResponseCode;
import com.sqlitesession.types.enums.SessionTypeEnum;
import com.sqlitesession.types.exception.DuplicateEntityException;
import com.sqlitesession.types.exception.EntityNotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class SessionOperationsTest {

    private SessionRepositoryImpl repository;

    @BeforeEach
    public void setUp() {
        repository = SessionRepositoryImpl.open(SessionStoreLocation.memory(), JsonCodec.create());
    }

    @AfterEach
    public void tearDown() {
        repository.close();
    }

    @Test
    public void shouldReadBackCreatedSession() {
        SessionEntity session = SessionEntity.create("s-1", SessionTypeEnum.AGENT);
        session.setMetadata(new HashMap<>(Map.of("tenant", "dev", "priority", 3)));

        repository.createSession(session);

        Optional<SessionEntity> stored = repository.readSession("s-1");
        Assertions.assertTrue(stored.isPresent());
        Assertions.assertEquals(session, stored.get());
        Assertions.assertNotSame(session, stored.get());
    }

    @Test
    public void shouldReturnFreshCopyOnEveryRead() {
        repository.createSession(SessionEntity.create("s-copy", SessionTypeEnum.AGENT));

        SessionEntity first = repository.readSession("s-copy").orElseThrow();
        first.getMetadata().put("mutated", true);

        SessionEntity second = repository.readSession("s-copy").orElseThrow();
        Assertions.assertFalse(second.getMetadata().containsKey("mutated"));
    }

    @Test
    public void shouldRoundTripNestedUnicodeAndEmptyPayloads() {
        Map<String, Object> deepest = new HashMap<>();
        deepest.put("emoji", "会话 🚀 ünïcödé");
        deepest.put("nothing", null);
        deepest.put("ratio", 0.25);
        deepest.put("flag", false);
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("empty", new HashMap<>());
        metadata.put("emptyList", List.of());
        metadata.put("level1", Map.of("level2", Map.of("level3", Map.of("level4", deepest))));
        metadata.put("list", List.of(1, "two", Map.of("three", 3)));
        metadata.put("camelCaseKey", "keys inside payloads are kept as-is");

        SessionEntity session = SessionEntity.create("s-unicode-会话", SessionTypeEnum.MULTI_AGENT);
        session.setMetadata(metadata);
        repository.createSession(session);

        SessionEntity stored = repository.readSession("s-unicode-会话").orElseThrow();
        Assertions.assertEquals(metadata, stored.getMetadata());
        Assertions.assertEquals(SessionTypeEnum.MULTI_AGENT, stored.getSessionType());
        Assertions.assertEquals(session.getCreatedAt(), stored.getCreatedAt());
    }

    @Test
    public void shouldRebuildNumbersByJsonType() {
        SessionEntity session = SessionEntity.create("s-numbers", SessionTypeEnum.AGENT);
        session.setMetadata(new HashMap<>(Map.of("small", 5L, "large", 5_000_000_000L, "ratio", 0.5f)));
        repository.createSession(session);

        Map<String, Object> stored = repository.readSession("s-numbers").orElseThrow().getMetadata();

        Assertions.assertEquals(Integer.valueOf(5), stored.get("small"));
        Assertions.assertEquals(Long.valueOf(5_000_000_000L), stored.get("large"));
        Assertions.assertEquals(Double.valueOf(0.5), stored.get("ratio"));
    }

    @Test
    public void shouldRejectDuplicateSession() {
        repository.createSession(SessionEntity.create("s-dup", SessionTypeEnum.AGENT));

        DuplicateEntityException exception = Assertions.assertThrows(DuplicateEntityException.class,
                () -> repository.createSession(SessionEntity.create("s-dup", SessionTypeEnum.AGENT)));
        Assertions.assertEquals(EntityKindEnum.SESSION, exception.getEntityKind());
        Assertions.assertEquals(ResponseCode.DUPLICATE_ENTITY.getCode(), exception.getCode());
        Assertions.assertTrue(exception.getMessage().contains("s-dup"));
    }

    @Test
    public void shouldReturnEmptyForUnknownSession() {
        Assertions.assertTrue(repository.readSession("missing").isEmpty());
    }

    @Test
    public void shouldRejectInvalidSessionBeforeWriting() {
        SessionEntity session = SessionEntity.create(" ", SessionTypeEnum.AGENT);

        Assertions.assertThrows(IllegalStateException.class, () -> repository.createSession(session));
    }

    @Test
    public void shouldFailDeletingUnknownSession() {
        EntityNotFoundException exception = Assertions.assertThrows(EntityNotFoundException.class,
                () -> repository.deleteSession("missing"));
        Assertions.assertEquals(EntityKindEnum.SESSION, exception.getEntityKind());
        Assertions.assertEquals(ResponseCode.NOT_FOUND.getCode(), exception.getCode());
    }

    @Test
    public void shouldCascadeDeleteToAgentsMessagesAndMultiAgents() {
        repository.createSession(SessionEntity.create("s-cascade", SessionTypeEnum.AGENT));
        repository.createAgent("s-cascade", SessionAgentEntity.create("a-1", Map.of(), Map.of()));
        repository.createMessage("s-cascade", "a-1", SessionMessageEntity.textMessage(0, MessageRoleEnum.USER, "hi"));
        repository.createMultiAgent("s-cascade", "graph-1", Map.of("current", "a-1"));

        repository.deleteSession("s-cascade");

        Assertions.assertTrue(repository.readSession("s-cascade").isEmpty());
        Assertions.assertTrue(repository.readAgent("s-cascade", "a-1").isEmpty());
        Assertions.assertThrows(EntityNotFoundException.class, () -> repository.readMessage("s-cascade", "a-1", 0));
        Assertions.assertThrows(EntityNotFoundException.class, () -> repository.readMultiAgent("s-cascade", "graph-1"));

        // 重建同名会话后，子数据不应复活
        repository.createSession(SessionEntity.create("s-cascade", SessionTypeEnum.AGENT));
        Assertions.assertTrue(repository.readAgent("s-cascade", "a-1").isEmpty());
        Assertions.assertTrue(repository.listMessages("s-cascade", "a-1").isEmpty());
    }

    @Test
    public void shouldOnlyDeleteTargetSession() {
        repository.createSession(SessionEntity.create("s-keep", SessionTypeEnum.AGENT));
        repository.createAgent("s-keep", SessionAgentEntity.create("a-1", Map.of(), Map.of()));
        repository.createSession(SessionEntity.create("s-drop", SessionTypeEnum.AGENT));
        repository.createAgent("s-drop", SessionAgentEntity.create("a-1", Map.of(), Map.of()));

        repository.deleteSession("s-drop");

        Assertions.assertTrue(repository.readAgent("s-keep", "a-1").isPresent());
    }
}
