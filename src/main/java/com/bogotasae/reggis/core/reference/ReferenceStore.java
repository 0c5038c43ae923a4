package com.bogotasae.reggis.core.reference;

import com.bogotasae.reggis.core.model.LegalEntity;
import com.bogotasae.reggis.logging.AppLogger;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable materials/clients dataset backed by an embedded H2 database.
 * <p>
 * Records are only ever inserted. Imports hold the write lock for their whole transaction, lookups and
 * {@link #readSession() read sessions} hold the read lock, so a validation pass never sees a half-applied import.
 */
public final class ReferenceStore implements AutoCloseable {
    private static final Logger LOGGER = AppLogger.get();

    private static final Set<String> SKIPPED_NIT_MARKERS = Set.of("no nit", "sin nit", "nonit");
    private static final String EMPTY_NIT_MARKER = "nit";

    private static final String[] SCHEMA = {
        """
        CREATE TABLE IF NOT EXISTS materials (
            id BIGINT AUTO_INCREMENT PRIMARY KEY,
            codigo VARCHAR(100) NOT NULL,
            descripcion VARCHAR(500) NOT NULL,
            sociedad VARCHAR(20) NOT NULL,
            created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
            CONSTRAINT uq_materials UNIQUE (codigo, sociedad)
        )
        """,
        """
        CREATE TABLE IF NOT EXISTS clients (
            id BIGINT AUTO_INCREMENT PRIMARY KEY,
            cod_padre VARCHAR(100) NOT NULL,
            nombre VARCHAR(500) NOT NULL,
            nit VARCHAR(50),
            created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
            CONSTRAINT uq_clients UNIQUE (cod_padre)
        )
        """,
        "CREATE INDEX IF NOT EXISTS idx_clients_nit ON clients(nit)"
    };

    private static final String INSERT_MATERIAL = "INSERT INTO materials (codigo, descripcion, sociedad) VALUES (?, ?, ?)";
    private static final String INSERT_CLIENT = "INSERT INTO clients (cod_padre, nombre, nit) VALUES (?, ?, ?)";

    private static final String FIND_MATERIAL = "SELECT 1 FROM materials WHERE codigo = ? AND sociedad = ?";
    private static final String FIND_CLIENT_BY_CODE = "SELECT 1 FROM clients WHERE cod_padre = ?";
    private static final String FIND_CLIENT = "SELECT 1 FROM clients WHERE nit = ?";

    private final HikariDataSource dataSource;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final boolean inMemory;

    private ReferenceStore(String jdbcUrl, String poolName, boolean inMemory) throws SQLException {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setUsername("sa");
        config.setPassword("");
        config.setMaximumPoolSize(4);
        config.setMinimumIdle(1);
        config.setPoolName(poolName);
        config.setAutoCommit(true);
        this.dataSource = new HikariDataSource(config);
        this.inMemory = inMemory;
        try {
            createSchema();
        } catch (SQLException e) {
            dataSource.close();
            throw e;
        }
    }

    /**
     * Opens (creating on first use) the database file at {@code databasePath}. H2 appends its own
     * {@code .mv.db} extension.
     */
    public static ReferenceStore open(Path databasePath) throws IOException, SQLException {
        Path absolute = databasePath.toAbsolutePath();
        Path parent = absolute.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        LOGGER.fine(() -> "Opening reference database " + absolute);
        return new ReferenceStore("jdbc:h2:file:" + absolute, "ReferenceStorePool", false);
    }

    /**
     * Private in-memory database, discarded on {@link #close()}.
     */
    public static ReferenceStore inMemory(String name) throws SQLException {
        return new ReferenceStore("jdbc:h2:mem:" + name + ";DB_CLOSE_DELAY=-1", "ReferenceStorePool-" + name, true);
    }

    private void createSchema() throws SQLException {
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            for (String ddl : SCHEMA) {
                statement.execute(ddl);
            }
        }
    }

    public ImportSummary importMaterials(List<MaterialRow> rows) throws SQLException {
        int inserted = 0;
        int existing = 0;
        List<RowRejection> rejections = new ArrayList<>();
        lock.writeLock().lock();
        try (Connection connection = dataSource.getConnection()) {
            connection.setAutoCommit(false);
            try (PreparedStatement find = connection.prepareStatement(FIND_MATERIAL);
                 PreparedStatement insert = connection.prepareStatement(INSERT_MATERIAL)) {
                for (MaterialRow row : rows) {
                    Optional<String> problem = materialProblem(row);
                    if (problem.isPresent()) {
                        rejections.add(new RowRejection(row.rowNumber(), problem.get()));
                        continue;
                    }
                    String entityTaxId = LegalEntity.fromText(row.entity()).orElseThrow().taxId();
                    if (exists(find, row.code(), entityTaxId)) {
                        existing++;
                        continue;
                    }
                    insert.setString(1, row.code());
                    insert.setString(2, row.description());
                    insert.setString(3, entityTaxId);
                    insert.executeUpdate();
                    inserted++;
                }
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        } finally {
            lock.writeLock().unlock();
        }
        ImportSummary summary = new ImportSummary(inserted, existing, 0, rejections);
        LOGGER.info("Materials import: " + summary);
        rejections.forEach(r -> LOGGER.fine(() -> "Material rejected, " + r));
        return summary;
    }

    public ImportSummary importClients(List<ClientRow> rows) throws SQLException {
        int inserted = 0;
        int existing = 0;
        int skipped = 0;
        List<RowRejection> rejections = new ArrayList<>();
        lock.writeLock().lock();
        try (Connection connection = dataSource.getConnection()) {
            connection.setAutoCommit(false);
            try (PreparedStatement find = connection.prepareStatement(FIND_CLIENT_BY_CODE);
                 PreparedStatement insert = connection.prepareStatement(INSERT_CLIENT)) {
                for (ClientRow row : rows) {
                    if (row.parentCode().isEmpty()) {
                        rejections.add(new RowRejection(row.rowNumber(), "missing parent code"));
                        continue;
                    }
                    if (row.name().isEmpty()) {
                        rejections.add(new RowRejection(row.rowNumber(), "missing name"));
                        continue;
                    }
                    String nitKey = row.nit().toLowerCase(Locale.ROOT);
                    if (SKIPPED_NIT_MARKERS.contains(nitKey)) {
                        skipped++;
                        LOGGER.fine(() -> "Client " + row.parentCode() + " not stored (NIT: " + row.nit() + ")");
                        continue;
                    }
                    if (exists(find, row.parentCode())) {
                        existing++;
                        continue;
                    }
                    String nit = row.nit().isEmpty() || EMPTY_NIT_MARKER.equals(nitKey) ? null : row.nit();
                    insert.setString(1, row.parentCode());
                    insert.setString(2, row.name());
                    insert.setString(3, nit);
                    insert.executeUpdate();
                    inserted++;
                }
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        } finally {
            lock.writeLock().unlock();
        }
        ImportSummary summary = new ImportSummary(inserted, existing, skipped, rejections);
        LOGGER.info("Clients import: " + summary);
        rejections.forEach(r -> LOGGER.fine(() -> "Client rejected, " + r));
        return summary;
    }

    private static boolean exists(PreparedStatement statement, String... parameters) throws SQLException {
        for (int i = 0; i < parameters.length; i++) {
            statement.setString(i + 1, parameters[i]);
        }
        try (ResultSet rs = statement.executeQuery()) {
            return rs.next();
        }
    }

    private static Optional<String> materialProblem(MaterialRow row) {
        if (row.code().isEmpty()) {
            return Optional.of("missing CODIGO");
        }
        if (row.description().isEmpty()) {
            return Optional.of("missing DESCRIPCION");
        }
        if (row.entity().isEmpty()) {
            return Optional.of("missing SOCIEDAD");
        }
        if (LegalEntity.fromText(row.entity()).isEmpty()) {
            return Optional.of("unknown SOCIEDAD '" + row.entity() + "'");
        }
        return Optional.empty();
    }

    public boolean lookupMaterial(String code, String entityTaxId) {
        try (ReferenceLookup session = readSession()) {
            return session.lookupMaterial(code, entityTaxId);
        }
    }

    public boolean lookupClient(String taxId) {
        try (ReferenceLookup session = readSession()) {
            return session.lookupClient(taxId);
        }
    }

    public ReferenceCounts counts() throws SQLException {
        lock.readLock().lock();
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            return new ReferenceCounts(count(statement, "materials"), count(statement, "clients"));
        } finally {
            lock.readLock().unlock();
        }
    }

    private static long count(Statement statement, String table) throws SQLException {
        try (ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM " + table)) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    /**
     * Opens a lookup view that holds the read lock and one pooled connection until closed. Answers are cached for
     * the life of the session since the data cannot change while it is open. The session must be closed by the
     * thread that opened it.
     */
    public ReferenceLookup readSession() {
        lock.readLock().lock();
        try {
            return new Session(dataSource.getConnection());
        } catch (SQLException e) {
            lock.readLock().unlock();
            throw new IllegalStateException("Cannot open reference database session", e);
        }
    }

    @Override
    public void close() {
        if (inMemory && !dataSource.isClosed()) {
            try (Connection connection = dataSource.getConnection();
                 Statement statement = connection.createStatement()) {
                statement.execute("SHUTDOWN");
            } catch (SQLException e) {
                LOGGER.log(Level.FINE, "In-memory reference database shutdown failed", e);
            }
        }
        dataSource.close();
    }

    private final class Session implements ReferenceLookup {
        private final Connection connection;
        private final Map<String, Boolean> materialCache = new HashMap<>();
        private final Map<String, Boolean> clientCache = new HashMap<>();
        private boolean closed;

        private Session(Connection connection) {
            this.connection = connection;
        }

        @Override
        public synchronized boolean lookupMaterial(String code, String entityTaxId) {
            if (isBlank(code) || isBlank(entityTaxId)) {
                return false;
            }
            String trimmedCode = code.trim();
            String trimmedEntity = entityTaxId.trim();
            return materialCache.computeIfAbsent(trimmedCode + '\u0000' + trimmedEntity,
                key -> query(FIND_MATERIAL, trimmedCode, trimmedEntity));
        }

        @Override
        public synchronized boolean lookupClient(String taxId) {
            if (isBlank(taxId)) {
                return false;
            }
            String trimmed = taxId.trim();
            return clientCache.computeIfAbsent(trimmed, key -> query(FIND_CLIENT, trimmed));
        }

        private boolean query(String sql, String... parameters) {
            if (closed) {
                throw new IllegalStateException("Reference session already closed");
            }
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                return exists(statement, parameters);
            } catch (SQLException e) {
                throw new IllegalStateException("Reference lookup failed", e);
            }
        }

        @Override
        public synchronized void close() {
            if (closed) {
                return;
            }
            closed = true;
            try {
                connection.close();
            } catch (SQLException e) {
                LOGGER.log(Level.FINE, "Closing reference session connection failed", e);
            } finally {
                lock.readLock().unlock();
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
