package com.sqlitesession.test.infrastructure;

import com.sqlitesession.domain.session.model.entity.SessionAgentEntity;
import com.sqlitesession.domain.session.model.entity.SessionEntity;
import com.sqlitesession.domain.session.model.entity.SessionMessageEntity;
import com.sqlitesession.infrastructure.repository.session.SessionRepositoryImpl;
import com.sqlitesession.infrastructure.sqlite.SessionStoreLocation;
import com.sqlitesession.infrastructure.util.JsonCodec;
import com.sqlitesession.types.enums.EntityKindEnum;
import com.sqlitesession.types.enums.MessageRoleEnum;
import com.sqlitesession.types.enums.SessionTypeEnum;
import com.sqlitesession.types.exception.EntityNotFoundException;
import com.sqlitesession.types.exception.StorageFailureException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.Map;

public class SessionStoreLifecycleTest {

    @TempDir
    Path tempDir;

    @Test
    public void shouldCreateParentDirectories() {
        Path dbFile = tempDir.resolve("nested").resolve("deeper").resolve("sessions.db");

        try (SessionRepositoryImpl repository = open(dbFile)) {
            Assertions.assertEquals(dbFile.toAbsolutePath(), repository.getLocation().toFilePath());
            repository.createSession(SessionEntity.create("s-1", SessionTypeEnum.AGENT));
        }

        Assertions.assertTrue(Files.exists(dbFile));
    }

    @Test
    public void shouldKeepDataAcrossReopen() {
        Path dbFile = tempDir.resolve("sessions.db");
        try (SessionRepositoryImpl repository = open(dbFile)) {
            repository.createSession(SessionEntity.create("s-1", SessionTypeEnum.AGENT));
            repository.createAgent("s-1", SessionAgentEntity.create("a-1", Map.of("k", "v"), Map.of()));
            repository.createMessage("s-1", "a-1", SessionMessageEntity.textMessage(0, MessageRoleEnum.USER, "persisted"));
        }

        try (SessionRepositoryImpl reopened = open(dbFile)) {
            Assertions.assertTrue(reopened.readSession("s-1").isPresent());
            Assertions.assertEquals("v", reopened.readAgent("s-1", "a-1").orElseThrow().getState().get("k"));
            Assertions.assertEquals(1, reopened.listMessages("s-1", "a-1").size());
        }
    }

    @Test
    public void shouldShareFileBetweenInstances() {
        Path dbFile = tempDir.resolve("shared.db");
        try (SessionRepositoryImpl first = open(dbFile);
             SessionRepositoryImpl second = open(dbFile)) {
            first.createSession(SessionEntity.create("s-1", SessionTypeEnum.AGENT));
            Assertions.assertTrue(second.readSession("s-1").isPresent());

            second.createAgent("s-1", SessionAgentEntity.create("a-1", Map.of(), Map.of()));
            Assertions.assertTrue(first.readAgent("s-1", "a-1").isPresent());
        }
    }

    @Test
    public void shouldRunFileStoreInWalMode() throws Exception {
        Path dbFile = tempDir.resolve("wal.db");
        try (SessionRepositoryImpl repository = open(dbFile)) {
            repository.createSession(SessionEntity.create("s-1", SessionTypeEnum.AGENT));
        }

        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + dbFile.toAbsolutePath());
             Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery("PRAGMA journal_mode")) {
            Assertions.assertTrue(rs.next());
            Assertions.assertEquals("wal", rs.getString(1).toLowerCase());
        }
    }

    @Test
    public void shouldIsolateMemoryStores() {
        try (SessionRepositoryImpl first = SessionRepositoryImpl.open(SessionStoreLocation.memory(), JsonCodec.create());
             SessionRepositoryImpl second = SessionRepositoryImpl.open(SessionStoreLocation.memory(), JsonCodec.create())) {
            first.createSession(SessionEntity.create("s-1", SessionTypeEnum.AGENT));

            Assertions.assertTrue(first.readSession("s-1").isPresent());
            Assertions.assertTrue(second.readSession("s-1").isEmpty());
        }
    }

    @Test
    public void shouldTolerateRepeatedClose() {
        SessionRepositoryImpl repository = open(tempDir.resolve("close.db"));

        repository.close();
        Assertions.assertDoesNotThrow(repository::close);
    }

    @Test
    public void shouldFailOperationsAfterClose() {
        SessionRepositoryImpl repository = open(tempDir.resolve("closed.db"));
        repository.close();

        Assertions.assertThrows(StorageFailureException.class, () -> repository.readSession("s-1"));
        Assertions.assertThrows(StorageFailureException.class,
                () -> repository.createSession(SessionEntity.create("s-1", SessionTypeEnum.AGENT)));
    }

    @Test
    public void shouldFailToOpenWhenParentIsAFile() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");

        StorageFailureException exception = Assertions.assertThrows(StorageFailureException.class,
                () -> open(blocker.resolve("sessions.db")));
        Assertions.assertTrue(exception.getMessage().contains("blocker"));
    }

    @Test
    public void shouldReleaseConnectionWhenFileIsNotADatabase() throws Exception {
        Path junk = Files.writeString(tempDir.resolve("junk.db"), "this is plain text, not an sqlite file");

        StorageFailureException exception = Assertions.assertThrows(StorageFailureException.class, () -> open(junk));
        Assertions.assertTrue(exception.getMessage().contains("junk.db"));

        Files.delete(junk);
        try (SessionRepositoryImpl repository = open(junk)) {
            repository.createSession(SessionEntity.create("s-1", SessionTypeEnum.AGENT));
            Assertions.assertTrue(repository.readSession("s-1").isPresent());
        }
    }

    @Test
    public void shouldReportCorruptSessionDocumentAsStorageFailure() throws Exception {
        Path dbFile = tempDir.resolve("corrupt-session.db");
        try (SessionRepositoryImpl repository = open(dbFile)) {
            repository.createSession(SessionEntity.create("s-1", SessionTypeEnum.AGENT));
            executeRaw(dbFile, "UPDATE sessions SET data = '{bad' WHERE session_id = 's-1'");

            StorageFailureException exception = Assertions.assertThrows(StorageFailureException.class,
                    () -> repository.readSession("s-1"));
            Assertions.assertEquals(EntityKindEnum.SESSION, exception.getEntityKind());
            Assertions.assertTrue(exception.getMessage().contains("session=s-1"));
        }
    }

    @Test
    public void shouldReportCorruptMultiAgentDocumentAsStorageFailure() throws Exception {
        Path dbFile = tempDir.resolve("corrupt-graph.db");
        try (SessionRepositoryImpl repository = open(dbFile)) {
            repository.createSession(SessionEntity.create("s-1", SessionTypeEnum.MULTI_AGENT));
            repository.createMultiAgent("s-1", "graph-1", Map.of("status", "pending"));
            executeRaw(dbFile, "UPDATE multi_agents SET data = '{bad' WHERE multi_agent_id = 'graph-1'");

            StorageFailureException exception = Assertions.assertThrows(StorageFailureException.class,
                    () -> repository.readMultiAgent("s-1", "graph-1"));
            Assertions.assertEquals(EntityKindEnum.MULTI_AGENT, exception.getEntityKind());
            Assertions.assertTrue(exception.getMessage().contains("multiAgent=graph-1"));
        }
    }

    @Test
    public void shouldTreatUpdateThatChangesNoRowAsNotFound() throws Exception {
        Path dbFile = tempDir.resolve("vanishing.db");
        try (SessionRepositoryImpl repository = open(dbFile)) {
            repository.createSession(SessionEntity.create("s-1", SessionTypeEnum.AGENT));
            SessionAgentEntity agent = SessionAgentEntity.create("a-1", Map.of("step", 1), Map.of());
            repository.createAgent("s-1", agent);
            // 行仍存在，但写入被跳过
            executeRaw(dbFile, "CREATE TRIGGER skip_agent_update BEFORE UPDATE ON agents BEGIN SELECT RAISE(IGNORE); END");

            agent.updateState(Map.of("step", 2), Map.of());
            EntityNotFoundException exception = Assertions.assertThrows(EntityNotFoundException.class,
                    () -> repository.updateAgent("s-1", agent));
            Assertions.assertEquals(EntityKindEnum.AGENT, exception.getEntityKind());
            Assertions.assertEquals(1, repository.readAgent("s-1", "a-1").orElseThrow().getState().get("step"));
        }
    }

    private SessionRepositoryImpl open(Path dbFile) {
        return SessionRepositoryImpl.open(SessionStoreLocation.resolve(dbFile.toString()), JsonCodec.create());
    }

    private void executeRaw(Path dbFile, String sql) throws Exception {
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + dbFile.toAbsolutePath());
             Statement statement = connection.createStatement()) {
            statement.execute(sql);
        }
    }
}
