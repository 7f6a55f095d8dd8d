package com.congruence.core.persistence;

import com.congruence.core.error.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Runs JDBC work inside Spring-managed transactions.
 *
 * <p>Connections are obtained through {@link DataSourceUtils}, so work started while a
 * transaction is active joins it: an outer {@link #inTransaction} spanning several
 * services commits once, and any failure rolls all of it back.
 */
public class TransactionRunner {

    private static final Logger log = LoggerFactory.getLogger(TransactionRunner.class);

    private final DataSource dataSource;
    private final TransactionTemplate required;
    private final TransactionTemplate nested;

    public TransactionRunner(DataSource dataSource) {
        this(dataSource, new DataSourceTransactionManager(dataSource));
    }

    /**
     * @param transactionManager must manage {@code dataSource}
     */
    public TransactionRunner(DataSource dataSource, PlatformTransactionManager transactionManager) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.required = new TransactionTemplate(transactionManager);
        this.nested = new TransactionTemplate(transactionManager);
        this.nested.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
    }

    /**
     * Runs {@code work} in the current transaction, or in a new one committed on return.
     *
     * @throws PersistenceException wrapping any {@link SQLException}; the transaction is rolled back
     */
    public <T> T inTransaction(String description, SqlWork<T> work) {
        try {
            return required.execute(status -> run(description, work));
        } catch (RuntimeException e) {
            log.warn("Rolled back transaction '{}': {}", description, e.getMessage());
            throw e;
        }
    }

    /**
     * Runs {@code work} under a savepoint of the current transaction. A failure rolls back
     * to the savepoint only and is rethrown; the enclosing transaction stays usable.
     */
    public <T> T inSavepoint(String description, SqlWork<T> work) {
        return nested.execute(status -> run(description, work));
    }

    /**
     * Work outside an explicit transaction. Joins the current one when there is one.
     */
    public <T> T withConnection(String description, SqlWork<T> work) {
        return run(description, work);
    }

    private <T> T run(String description, SqlWork<T> work) {
        Connection conn = DataSourceUtils.getConnection(dataSource);
        try {
            return work.execute(conn);
        } catch (SQLException e) {
            throw new PersistenceException("'%s' failed: %s".formatted(description, e.getMessage()), e);
        } finally {
            DataSourceUtils.releaseConnection(conn, dataSource);
        }
    }
}
