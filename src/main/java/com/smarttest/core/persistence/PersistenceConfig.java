package com.smarttest.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Clock;

/**
 * Provides the run and project repositories.
 * <p>
 * When {@code spring.datasource.url} is set, JDBC repositories are created and their tables
 * ensured on startup. Otherwise in-memory repositories are used; state is lost on restart.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean
    @ConditionalOnProperty(name = "spring.datasource.url")
    public RunRepository jdbcRunRepository(DataSource dataSource, ObjectMapper objectMapper, Clock clock)
            throws SQLException {
        log.info("Configuring JDBC run repository");
        var repository = new JdbcRunRepository(dataSource, objectMapper, clock);
        repository.createTables();
        return repository;
    }

    @Bean
    @ConditionalOnProperty(name = "spring.datasource.url")
    public ProjectRepository jdbcProjectRepository(DataSource dataSource) throws SQLException {
        var repository = new JdbcProjectRepository(dataSource);
        repository.createTables();
        return repository;
    }

    @Bean
    @ConditionalOnMissingBean(RunRepository.class)
    public RunRepository inMemoryRunRepository(Clock clock) {
        log.info("No datasource configured; using in-memory run repository (runs will not persist across restarts)");
        return new InMemoryRunRepository(clock);
    }

    @Bean
    @ConditionalOnMissingBean(ProjectRepository.class)
    public ProjectRepository inMemoryProjectRepository() {
        return new InMemoryProjectRepository();
    }
}
