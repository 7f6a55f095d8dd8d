package com.congruence.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;

/**
 * Creates the pipeline tables if they do not exist yet.
 * <p>
 * {@code projects} and {@code git_credentials} belong to the project and
 * account subsystems; they are only created here so the pipeline can run
 * standalone. The SQL is portable between PostgreSQL and H2.
 */
public class SchemaInitializer {

    private static final Logger log = LoggerFactory.getLogger(SchemaInitializer.class);

    static final String CREATE_PROJECTS = """
            CREATE TABLE IF NOT EXISTS projects (
                id             BIGINT PRIMARY KEY,
                repo_url       VARCHAR(1024) NOT NULL,
                default_branch VARCHAR(255),
                owner_id       VARCHAR(255)
            )
            """;

    static final String CREATE_GIT_CREDENTIALS = """
            CREATE TABLE IF NOT EXISTS git_credentials (
                id                BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                owner_id          VARCHAR(255) NOT NULL,
                provider          VARCHAR(32) NOT NULL,
                credential_type   VARCHAR(32) NOT NULL,
                encrypted_payload TEXT,
                username          VARCHAR(255),
                is_active         BOOLEAN NOT NULL DEFAULT TRUE,
                expires_at        TIMESTAMP,
                last_used_at      TIMESTAMP,
                use_count         INTEGER NOT NULL DEFAULT 0,
                last_error        TEXT,
                CONSTRAINT uq_git_credentials UNIQUE (owner_id, provider, credential_type)
            )
            """;

    static final String CREATE_MINING_RUNS = """
            CREATE TABLE IF NOT EXISTS mining_runs (
                id            BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                project_id    BIGINT NOT NULL,
                repo_url      VARCHAR(1024),
                branch        VARCHAR(255),
                data_type     VARCHAR(64) NOT NULL,
                command       VARCHAR(255),
                options_json  TEXT,
                status        VARCHAR(32) NOT NULL,
                created_at    TIMESTAMP NOT NULL,
                started_at    TIMESTAMP,
                finished_at   TIMESTAMP,
                artifact_dir  VARCHAR(1024),
                error_code    VARCHAR(64),
                error_message TEXT,
                run_log       TEXT
            )
            """;

    static final String CREATE_CONTRIBUTORS = """
            CREATE TABLE IF NOT EXISTS contributors (
                id    BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                login VARCHAR(255) NOT NULL,
                email VARCHAR(320),
                CONSTRAINT uq_contributors_login UNIQUE (login)
            )
            """;

    static final String CREATE_PROJECT_CONTRIBUTORS = """
            CREATE TABLE IF NOT EXISTS project_contributors (
                project_id                 BIGINT NOT NULL,
                contributor_id             BIGINT NOT NULL REFERENCES contributors (id),
                miner_user_id              TEXT,
                files_modified             INTEGER NOT NULL,
                total_modifications        INTEGER NOT NULL,
                avg_modifications_per_file DOUBLE PRECISION NOT NULL,
                functional_role            VARCHAR(32) NOT NULL,
                role_confidence            DOUBLE PRECISION NOT NULL,
                is_core_contributor        BOOLEAN NOT NULL,
                role_overridden            BOOLEAN NOT NULL DEFAULT FALSE,
                mined_branch               VARCHAR(255),
                last_analysis_at           TIMESTAMP,
                file_types                 TEXT,
                PRIMARY KEY (project_id, contributor_id)
            )
            """;

    static final String CREATE_CODE_FILES = """
            CREATE TABLE IF NOT EXISTS code_files (
                id         BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                project_id BIGINT NOT NULL,
                file_path  VARCHAR(2048) NOT NULL,
                language   VARCHAR(64),
                loc        INTEGER,
                CONSTRAINT uq_code_files_path UNIQUE (project_id, file_path)
            )
            """;

    static final String CREATE_TA_ENTRIES = """
            CREATE TABLE IF NOT EXISTS ta_entries (
                project_id     BIGINT NOT NULL,
                branch         VARCHAR(255) NOT NULL,
                contributor_id BIGINT NOT NULL REFERENCES contributors (id),
                file_id        BIGINT NOT NULL REFERENCES code_files (id),
                edit_count     INTEGER NOT NULL CHECK (edit_count >= 0),
                PRIMARY KEY (project_id, branch, contributor_id, file_id)
            )
            """;

    static final String CREATE_TD_EDGES = """
            CREATE TABLE IF NOT EXISTS td_edges (
                project_id BIGINT NOT NULL,
                branch     VARCHAR(255) NOT NULL,
                file_a     BIGINT NOT NULL REFERENCES code_files (id),
                file_b     BIGINT NOT NULL REFERENCES code_files (id),
                weight     DOUBLE PRECISION NOT NULL CHECK (weight >= 0),
                PRIMARY KEY (project_id, branch, file_a, file_b),
                CONSTRAINT ck_td_edges_order CHECK (file_a < file_b)
            )
            """;

    static final String CREATE_CA_EDGES = """
            CREATE TABLE IF NOT EXISTS ca_edges (
                project_id    BIGINT NOT NULL,
                branch        VARCHAR(255) NOT NULL,
                contributor_i BIGINT NOT NULL REFERENCES contributors (id),
                contributor_j BIGINT NOT NULL REFERENCES contributors (id),
                weight        DOUBLE PRECISION NOT NULL CHECK (weight >= 0),
                evidence      VARCHAR(32) NOT NULL,
                PRIMARY KEY (project_id, branch, contributor_i, contributor_j),
                CONSTRAINT ck_ca_edges_order CHECK (contributor_i < contributor_j)
            )
            """;

    static final String CREATE_COORDINATION_RUNS = """
            CREATE TABLE IF NOT EXISTS coordination_runs (
                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                project_id      BIGINT NOT NULL,
                branch          VARCHAR(255),
                algorithm       VARCHAR(16) NOT NULL,
                td_source       VARCHAR(8) NOT NULL,
                ca_source       VARCHAR(64) NOT NULL,
                class_config    TEXT,
                class_breakdown TEXT,
                score           DOUBLE PRECISION NOT NULL CHECK (score >= 0 AND score <= 1),
                cr_count        INTEGER NOT NULL CHECK (cr_count >= 0),
                diff_count      INTEGER NOT NULL CHECK (diff_count >= 0),
                created_at      TIMESTAMP NOT NULL,
                CONSTRAINT ck_coordination_runs_diff CHECK (diff_count <= cr_count)
            )
            """;

    static final String CREATE_CR_EDGES = """
            CREATE TABLE IF NOT EXISTS cr_edges (
                run_id        BIGINT NOT NULL REFERENCES coordination_runs (id),
                contributor_i BIGINT NOT NULL REFERENCES contributors (id),
                contributor_j BIGINT NOT NULL REFERENCES contributors (id),
                weight        DOUBLE PRECISION NOT NULL CHECK (weight >= 0),
                PRIMARY KEY (run_id, contributor_i, contributor_j),
                CONSTRAINT ck_cr_edges_order CHECK (contributor_i < contributor_j)
            )
            """;

    static final List<String> ALL = List.of(
            CREATE_PROJECTS, CREATE_GIT_CREDENTIALS, CREATE_MINING_RUNS, CREATE_CONTRIBUTORS,
            CREATE_PROJECT_CONTRIBUTORS, CREATE_CODE_FILES, CREATE_TA_ENTRIES, CREATE_TD_EDGES,
            CREATE_CA_EDGES, CREATE_COORDINATION_RUNS, CREATE_CR_EDGES);

    private final DataSource dataSource;

    public SchemaInitializer(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    /**
     * Creates every table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String ddl : ALL) {
                stmt.execute(ddl);
            }
        }
        log.info("Schema ensured ({} tables)", ALL.size());
    }
}
