package com.clustermgmt.querytelemetry.source;

import com.clustermgmt.querytelemetry.config.TelemetryProperties;
import com.clustermgmt.querytelemetry.exception.ErrorKind;
import com.clustermgmt.querytelemetry.exception.TelemetryException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PgStatStatementsSourceTest {

    private final TelemetryProperties props = new TelemetryProperties();
    private final TargetDataSourceRegistry registry = new TargetDataSourceRegistry(props);
    private final PgStatStatementsSource source = new PgStatStatementsSource(registry, props);

    @AfterEach
    void tearDown() {
        registry.closeAll();
    }

    @Test
    void unconfiguredTargetIsUnavailable() {
        assertThatThrownBy(() -> source.fetchSnapshot(42L))
            .isInstanceOf(TelemetryException.class)
            .hasMessageContaining("42")
            .extracting(e -> ((TelemetryException) e).getKind())
            .isEqualTo(ErrorKind.SOURCE_UNAVAILABLE);
    }

    @Test
    void unreachableTargetIsUnavailable() {
        TelemetryProperties.TargetConnection target = new TelemetryProperties.TargetConnection();
        target.setUrl("jdbc:postgresql://127.0.0.1:1/nowhere");
        target.setUsername("monitor");
        target.setPassword("secret");
        props.getSource().getTargets().put(43L, target);
        props.getSource().setTimeoutMs(500);

        assertThatThrownBy(() -> source.fetchSnapshot(43L))
            .isInstanceOf(TelemetryException.class)
            .extracting(e -> ((TelemetryException) e).getKind())
            .isEqualTo(ErrorKind.SOURCE_UNAVAILABLE);
    }

    @Test
    void rowsAreMappedFromDriverTypes() {
        Map<String, Object> row = new HashMap<>();
        row.put("query", "SELECT * FROM t WHERE id = $1");
        row.put("calls", 12L);
        row.put("total_exec_time", new BigDecimal("120.5"));
        row.put("min_exec_time", 1.5d);
        row.put("max_exec_time", 30.0d);
        row.put("mean_exec_time", null);

        SnapshotRow snapshotRow = PgStatStatementsSource.toSnapshotRow(row);

        assertThat(snapshotRow.rawText()).isEqualTo("SELECT * FROM t WHERE id = $1");
        assertThat(snapshotRow.statistics()).isEqualTo(new QueryStatistics(12L, 120.5, 1.5, 30.0, null));
    }
}
