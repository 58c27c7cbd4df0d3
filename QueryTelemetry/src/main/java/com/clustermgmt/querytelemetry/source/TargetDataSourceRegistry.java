package com.clustermgmt.querytelemetry.source;

import com.clustermgmt.querytelemetry.config.TelemetryProperties;
import com.clustermgmt.querytelemetry.exception.TelemetryException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Small connection pools towards the monitored targets, created on first use from
 * telemetry.source.targets and closed on shutdown.
 */
@Component
@Slf4j
public class TargetDataSourceRegistry {

    private static final long SOCKET_TIMEOUT_MARGIN_SECONDS = 5;

    private final TelemetryProperties props;
    private final ConcurrentHashMap<Long, HikariDataSource> pools = new ConcurrentHashMap<>();

    public TargetDataSourceRegistry(TelemetryProperties props) {
        this.props = props;
    }

    public DataSource get(long targetId) {
        TelemetryProperties.TargetConnection target = props.getSource().getTargets().get(targetId);
        if (target == null || StringUtils.isBlank(target.getUrl())) {
            throw TelemetryException.sourceUnavailable(targetId, "no connection configured", null);
        }
        return pools.computeIfAbsent(targetId, id -> createPool(id, target));
    }

    private HikariDataSource createPool(long targetId, TelemetryProperties.TargetConnection target) {
        HikariConfig config = poolConfig(targetId, target);
        log.info("Created connection pool for target {} ({})", targetId, target.getUrl());
        return new HikariDataSource(config);
    }

    HikariConfig poolConfig(long targetId, TelemetryProperties.TargetConnection target) {
        long timeoutMs = props.getSource().getTimeoutMs();
        HikariConfig config = new HikariConfig();
        config.setPoolName("telemetry-target-" + targetId);
        config.setJdbcUrl(target.getUrl());
        config.setUsername(target.getUsername());
        config.setPassword(target.getPassword());
        config.setMaximumPoolSize(2);
        config.setMinimumIdle(0);
        config.setReadOnly(true);
        config.setConnectionTimeout(Math.max(250L, timeoutMs));
        // A fetch abandoned on timeout must not keep its thread and connection blocked:
        // the server cancels the statement, the socket timeout covers a silent server
        config.addDataSourceProperty("options", "-c statement_timeout=" + timeoutMs);
        config.addDataSourceProperty("socketTimeout", String.valueOf(timeoutMs / 1000 + SOCKET_TIMEOUT_MARGIN_SECONDS));
        // Fail lazily: an unreachable target must surface per cycle, not at pool creation
        config.setInitializationFailTimeout(-1);
        return config;
    }

    @PreDestroy
    public void closeAll() {
        for (Map.Entry<Long, HikariDataSource> entry : pools.entrySet()) {
            log.info("Closing connection pool for target {}", entry.getKey());
            entry.getValue().close();
        }
        pools.clear();
    }
}
