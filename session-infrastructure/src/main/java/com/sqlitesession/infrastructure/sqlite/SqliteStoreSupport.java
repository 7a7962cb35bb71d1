package com.sqlitesession.infrastructure.sqlite;

import com.sqlitesession.infrastructure.dao.MultiAgentStateDao;
import com.sqlitesession.infrastructure.dao.SessionAgentDao;
import com.sqlitesession.infrastructure.dao.SessionDao;
import com.sqlitesession.infrastructure.dao.SessionMessageDao;
import com.sqlitesession.types.exception.StorageFailureException;
import lombok.extern.slf4j.Slf4j;
import org.apache.ibatis.builder.xml.XMLMapperBuilder;
import org.apache.ibatis.mapping.Environment;
import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactory;
import org.apache.ibatis.session.SqlSessionFactoryBuilder;
import org.apache.ibatis.transaction.jdbc.JdbcTransactionFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.jdbc.datasource.init.ScriptUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * SQLite 连接与 MyBatis SqlSessionFactory 的持有者。
 * <p>
 * 每个实例只持有一个 JDBC 连接（{@link SingleConnectionDataSource}，屏蔽 close），
 * 打开时启用 WAL 与外键约束并执行幂等建表脚本。每次操作开启自动提交的 SqlSession。
 * </p>
 *
 * @author getoffer
 * @since 2026-10-19
 */
@Slf4j
public final class SqliteStoreSupport implements AutoCloseable {

    private static final String SCHEMA_SCRIPT = "sql/session-schema.sql";

    private static final List<String> MAPPER_RESOURCES = List.of(
            "mybatis/mapper/SessionMapper.xml",
            "mybatis/mapper/SessionAgentMapper.xml",
            "mybatis/mapper/SessionMessageMapper.xml",
            "mybatis/mapper/MultiAgentStateMapper.xml"
    );

    private final SessionStoreLocation location;
    private final SingleConnectionDataSource dataSource;
    private final SqlSessionFactory sqlSessionFactory;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private SqliteStoreSupport(SessionStoreLocation location,
                               SingleConnectionDataSource dataSource,
                               SqlSessionFactory sqlSessionFactory) {
        this.location = location;
        this.dataSource = dataSource;
        this.sqlSessionFactory = sqlSessionFactory;
    }

    /**
     * 打开存储：准备目录、建立连接、设置 PRAGMA、初始化表结构。
     * 任一步失败都会先释放连接再抛出 StorageFailureException。
     */
    public static SqliteStoreSupport open(SessionStoreLocation location) {
        SingleConnectionDataSource dataSource = null;
        try {
            prepareParentDirectory(location);
            dataSource = new SingleConnectionDataSource(location.toJdbcUrl(), true);
            dataSource.setDriverClassName("org.sqlite.JDBC");
            dataSource.setAutoCommit(true);

            try (Connection connection = dataSource.getConnection()) {
                applyPragmas(connection, location);
                ScriptUtils.executeSqlScript(connection, new ClassPathResource(SCHEMA_SCRIPT));
            }

            SqlSessionFactory factory = buildSqlSessionFactory(dataSource);
            log.info("SQLite session store opened: {}", location.isMemory() ? location.getDbPath() : location.toFilePath());
            return new SqliteStoreSupport(location, dataSource, factory);
        } catch (StorageFailureException ex) {
            destroyQuietly(dataSource, ex);
            throw ex;
        } catch (Exception ex) {
            StorageFailureException failure = new StorageFailureException(
                    "open session store at " + location.getDbPath(), null, null, ex);
            destroyQuietly(dataSource, failure);
            throw failure;
        }
    }

    /**
     * 以自动提交模式执行一次 Mapper 操作。
     */
    public <M, R> R execute(Class<M> mapperType, Function<M, R> action) {
        if (closed.get()) {
            throw new StorageFailureException("access closed session store at " + location.getDbPath(), null, null, null);
        }
        try (SqlSession session = sqlSessionFactory.openSession(true)) {
            return action.apply(session.getMapper(mapperType));
        }
    }

    public SessionStoreLocation getLocation() {
        return location;
    }

    /**
     * 释放连接，重复调用无副作用。
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            dataSource.destroy();
            log.info("SQLite session store closed: {}", location.getDbPath());
        }
    }

    private static void prepareParentDirectory(SessionStoreLocation location) throws IOException {
        if (location.isMemory()) {
            return;
        }
        Path parent = location.toFilePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static void applyPragmas(Connection connection, SessionStoreLocation location) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            String journalMode = queryString(statement, "PRAGMA journal_mode=WAL");
            // 内存库只会返回 memory
            if (!location.isMemory() && !"wal".equalsIgnoreCase(journalMode)) {
                throw new StorageFailureException("enable WAL journaling at " + location.getDbPath()
                        + " (engine reported journal_mode=" + journalMode + ")", null, null, null);
            }
            statement.execute("PRAGMA foreign_keys=ON");
            if (!"1".equals(queryString(statement, "PRAGMA foreign_keys"))) {
                throw new StorageFailureException("enable foreign key enforcement at " + location.getDbPath(),
                        null, null, null);
            }
        }
    }

    private static String queryString(Statement statement, String sql) throws SQLException {
        try (ResultSet rs = statement.executeQuery(sql)) {
            return rs.next() ? rs.getString(1) : null;
        }
    }

    private static SqlSessionFactory buildSqlSessionFactory(SingleConnectionDataSource dataSource) throws IOException {
        Environment environment = new Environment("sqlite", new JdbcTransactionFactory(), dataSource);
        Configuration configuration = new Configuration(environment);
        configuration.setMapUnderscoreToCamelCase(true);
        configuration.setCacheEnabled(false);
        for (String resource : MAPPER_RESOURCES) {
            try (InputStream in = new ClassPathResource(resource).getInputStream()) {
                new XMLMapperBuilder(in, configuration, resource, configuration.getSqlFragments()).parse();
            }
        }
        // XML 命名空间已绑定 Mapper，这里校验四个 DAO 均已注册
        for (Class<?> mapper : List.of(SessionDao.class, SessionAgentDao.class, SessionMessageDao.class, MultiAgentStateDao.class)) {
            if (!configuration.hasMapper(mapper)) {
                throw new IllegalStateException("Mapper not registered: " + mapper.getName());
            }
        }
        return new SqlSessionFactoryBuilder().build(configuration);
    }

    private static void destroyQuietly(SingleConnectionDataSource dataSource, Exception primary) {
        if (dataSource == null) {
            return;
        }
        try {
            dataSource.destroy();
        } catch (RuntimeException ex) {
            primary.addSuppressed(ex);
        }
    }
}
