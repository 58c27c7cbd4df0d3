package com.clustermgmt.querytelemetry.db;

import lombok.extern.slf4j.Slf4j;
import org.javalite.activejdbc.Base;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.function.Supplier;

/**
 * Scopes an ActiveJDBC connection (and optionally a transaction) to one unit of work
 * on the current thread.
 *
 * Calls nest: when the thread already holds a connection it is reused and left open,
 * and a transaction requested inside another transaction joins the outer one.
 */
@Slf4j
public class DbSession {

    private static final ThreadLocal<Boolean> TRANSACTION_OPEN = ThreadLocal.withInitial(() -> Boolean.FALSE);

    private final DataSource dataSource;

    public DbSession(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public <T> T withConnection(Supplier<T> work) {
        boolean connectionOpened = false;
        if (!Base.hasConnection()) {
            Base.open(dataSource);
            connectionOpened = true;
        }
        try {
            return work.get();
        } finally {
            if (connectionOpened && Base.hasConnection()) {
                Base.close();
            }
        }
    }

    public void withConnection(Runnable work) {
        withConnection(() -> {
            work.run();
            return null;
        });
    }

    public <T> T inTransaction(Supplier<T> work) {
        return withConnection(() -> {
            if (TRANSACTION_OPEN.get()) {
                return work.get();
            }
            Base.openTransaction();
            TRANSACTION_OPEN.set(Boolean.TRUE);
            try {
                T result = work.get();
                Base.commitTransaction();
                return result;
            } catch (RuntimeException e) {
                rollback(e);
                throw e;
            } finally {
                TRANSACTION_OPEN.set(Boolean.FALSE);
                restoreAutoCommit();
            }
        });
    }

    public void inTransaction(Runnable work) {
        inTransaction(() -> {
            work.run();
            return null;
        });
    }

    private void rollback(RuntimeException cause) {
        try {
            Base.rollbackTransaction();
        } catch (RuntimeException rollbackFailure) {
            log.warn("Rollback failed after {}: {}", cause.getMessage(), rollbackFailure.getMessage());
            cause.addSuppressed(rollbackFailure);
        }
    }

    private void restoreAutoCommit() {
        try {
            if (Base.hasConnection()) {
                Base.connection().setAutoCommit(true);
            }
        } catch (SQLException e) {
            log.warn("Unable to restore auto-commit: {}", e.getMessage());
        }
    }
}
