package com.congruence.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Spring {@link Configuration} wiring the JDBC repositories onto the
 * application {@link DataSource}. Tables are created on startup.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean
    public TransactionRunner transactionRunner(DataSource dataSource, PlatformTransactionManager transactionManager)
            throws SQLException {
        log.info("Configuring JDBC persistence");
        new SchemaInitializer(dataSource).createTables();
        return new TransactionRunner(dataSource, transactionManager);
    }

    @Bean
    public ProjectRepository projectRepository(TransactionRunner tx) {
        return new ProjectRepository(tx);
    }

    @Bean
    public CredentialRepository credentialRepository(TransactionRunner tx) {
        return new CredentialRepository(tx);
    }

    @Bean
    public MiningRunRepository miningRunRepository(TransactionRunner tx) {
        return new MiningRunRepository(tx);
    }

    @Bean
    public ContributorRepository contributorRepository(TransactionRunner tx) {
        return new ContributorRepository(tx);
    }

    @Bean
    public ProjectContributorRepository projectContributorRepository(TransactionRunner tx, ObjectMapper objectMapper) {
        return new ProjectContributorRepository(tx, objectMapper);
    }

    @Bean
    public CodeFileRepository codeFileRepository() {
        return new CodeFileRepository();
    }

    @Bean
    public GraphRepository graphRepository(TransactionRunner tx) {
        return new GraphRepository(tx);
    }

    @Bean
    public CoordinationRunRepository coordinationRunRepository(TransactionRunner tx) {
        return new CoordinationRunRepository(tx);
    }
}
