package com.clustermgmt.querytelemetry.config;

import com.clustermgmt.querytelemetry.db.DbSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * ActiveJDBC Database Configuration
 *
 * ActiveJDBC binds connections to the calling thread, so nothing is opened here:
 * poll loops, maintenance jobs and request threads each borrow a pooled
 * connection through {@link DbSession} for the duration of one unit of work.
 */
@Configuration
@Slf4j
public class ActiveJDBCConfig {

    private final DataSource dataSource;

    public ActiveJDBCConfig(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Bean
    public DbSession dbSession() {
        log.debug("ActiveJDBC sessions backed by pooled DataSource {}", dataSource.getClass().getSimpleName());
        return new DbSession(dataSource);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
