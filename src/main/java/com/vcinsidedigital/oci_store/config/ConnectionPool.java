package com.vcinsidedigital.oci_store.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public class ConnectionPool implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionPool.class);
    private static ConnectionPool instance;

    private final DatabaseConfig config;
    private final BlockingQueue<PooledConnection> availableConnections;
    private final AtomicInteger activeConnections;

    private final int maxPoolSize;
    private final int minIdle;
    private final long connectionTimeout;
    private final long idleTimeout;
    private final long maxLifetime;

    private volatile boolean isShutdown = false;

    public ConnectionPool(DatabaseConfig config) {
        this.config = config;
        this.maxPoolSize = config.getMaxPoolSize();
        this.minIdle = config.getMinIdle();
        this.connectionTimeout = config.getConnectionTimeout();
        this.idleTimeout = 600000; // 10 minutes
        this.maxLifetime = 1800000; // 30 minutes

        this.availableConnections = new ArrayBlockingQueue<>(maxPoolSize);
        this.activeConnections = new AtomicInteger(0);

        try {
            Class.forName(config.getDriverClassName());

            for (int i = 0; i < minIdle && reserveSlot(); i++) {
                availableConnections.offer(openConnection());
            }

            logger.info("ConnectionPool initialized for {} with {} connections", config.getType(), minIdle);
        } catch (ClassNotFoundException | SQLException e) {
            throw new IllegalStateException("Failed to initialize ConnectionPool for " + config, e);
        }
    }

    /**
     * Replaces the process-wide pool, closing the previous one if any.
     */
    public static synchronized ConnectionPool initialize(DatabaseConfig config) {
        if (instance != null) {
            instance.close();
        }
        instance = new ConnectionPool(config);
        return instance;
    }

    public static synchronized ConnectionPool getInstance() {
        if (instance == null) {
            throw new IllegalStateException("ConnectionPool not initialized");
        }
        return instance;
    }

    /**
     * Leases a connection. Closing the lease hands the connection back to the pool.
     *
     * @throws SQLException if the pool is shut down, exhausted past the timeout, or the driver fails
     */
    public Lease acquire() throws SQLException {
        if (isShutdown) {
            throw new SQLException("ConnectionPool is shutdown");
        }

        try {
            PooledConnection pooledConn = availableConnections.poll();

            if (pooledConn == null) {
                pooledConn = reserveSlot() ? openConnection() : awaitIdleConnection();
            }

            if (!isConnectionValid(pooledConn)) {
                logger.warn("Invalid connection detected, creating new one");
                closeConnection(pooledConn);
                pooledConn = reserveSlot() ? openConnection() : awaitIdleConnection();
            }

            pooledConn.setLastUsed(System.currentTimeMillis());
            return new Lease(pooledConn, this);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SQLException("Interrupted while waiting for connection", e);
        }
    }

    void release(PooledConnection connection) {
        if (isShutdown) {
            closeConnection(connection);
            return;
        }

        try {
            Connection conn = connection.getConnection();
            if (!conn.getAutoCommit()) {
                conn.rollback();
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            logger.warn("Could not reset returned connection, discarding it", e);
            closeConnection(connection);
            return;
        }

        long now = System.currentTimeMillis();
        long age = now - connection.getCreatedAt();
        long idleTime = now - connection.getLastUsed();

        if (age > maxLifetime || idleTime > idleTimeout) {
            logger.debug("Closing aged/idle connection");
            closeConnection(connection);
        } else if (!availableConnections.offer(connection)) {
            logger.warn("Failed to return connection to pool, closing it");
            closeConnection(connection);
        }
    }

    private PooledConnection awaitIdleConnection() throws SQLException, InterruptedException {
        PooledConnection pooledConn = availableConnections.poll(connectionTimeout, TimeUnit.MILLISECONDS);
        if (pooledConn == null) {
            throw new SQLException("Connection timeout - pool exhausted");
        }
        return pooledConn;
    }

    /**
     * Claims one of the {@code maxPoolSize} slots before a connection is opened for it.
     */
    private boolean reserveSlot() {
        while (true) {
            int current = activeConnections.get();
            if (current >= maxPoolSize) {
                return false;
            }
            if (activeConnections.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /**
     * Opens a connection for a slot already taken with {@link #reserveSlot()}; gives the slot back on failure.
     */
    private PooledConnection openConnection() throws SQLException {
        Connection conn;
        try {
            conn = DriverManager.getConnection(config.getJdbcUrl(), config.getConnectionProperties());
        } catch (SQLException e) {
            activeConnections.decrementAndGet();
            throw e;
        }

        logger.debug("Created new connection. Active: {}", activeConnections.get());
        return new PooledConnection(conn);
    }

    private boolean isConnectionValid(PooledConnection pooledConn) {
        try {
            Connection conn = pooledConn.getConnection();
            return conn != null && !conn.isClosed() && conn.isValid(1);
        } catch (SQLException e) {
            return false;
        }
    }

    private void closeConnection(PooledConnection pooledConn) {
        try {
            if (pooledConn != null && pooledConn.getConnection() != null) {
                pooledConn.getConnection().close();
                activeConnections.decrementAndGet();
                logger.debug("Closed connection. Active: {}", activeConnections.get());
            }
        } catch (SQLException e) {
            logger.error("Error closing connection", e);
        }
    }

    public DatabaseConfig getConfig() {
        return config;
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }

    public int getIdleConnections() {
        return availableConnections.size();
    }

    public boolean isShutdown() {
        return isShutdown;
    }

    @Override
    public void close() {
        if (isShutdown) {
            return;
        }

        isShutdown = true;
        logger.info("Closing ConnectionPool");

        PooledConnection conn;
        while ((conn = availableConnections.poll()) != null) {
            closeConnection(conn);
        }

        logger.info("ConnectionPool closed. Remaining active connections: {}",
                activeConnections.get());
    }

    static class PooledConnection {
        private final Connection connection;
        private final long createdAt;
        private volatile long lastUsed;

        PooledConnection(Connection connection) {
            this.connection = connection;
            this.createdAt = System.currentTimeMillis();
            this.lastUsed = createdAt;
        }

        Connection getConnection() {
            return connection;
        }

        long getCreatedAt() {
            return createdAt;
        }

        long getLastUsed() {
            return lastUsed;
        }

        void setLastUsed(long lastUsed) {
            this.lastUsed = lastUsed;
        }
    }

    /**
     * A connection on loan from the pool. Not thread-safe; meant for one try-with-resources block.
     */
    public static final class Lease implements AutoCloseable {
        private final PooledConnection pooledConnection;
        private final ConnectionPool pool;
        private boolean closed = false;

        private Lease(PooledConnection pooledConnection, ConnectionPool pool) {
            this.pooledConnection = pooledConnection;
            this.pool = pool;
        }

        public Connection connection() throws SQLException {
            if (closed) {
                throw new SQLException("Lease is closed");
            }
            return pooledConnection.getConnection();
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                pool.release(pooledConnection);
            }
        }
    }
}
