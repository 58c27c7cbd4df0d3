package com.clustermgmt.querytelemetry.service;

import com.clustermgmt.querytelemetry.support.StoreTestSupport;
import org.javalite.activejdbc.Base;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConsistencyMaintainerTest extends StoreTestSupport {

    @Test
    void recomputeRestoresCountersFromChildren() {
        long id = sampleStore.ingest(1L, "SELECT * FROM t WHERE id IN ($1)", stats(1, 1)).canonicalQueryId();
        sampleStore.ingest(1L, "SELECT * FROM t WHERE id IN ($1, $2)", stats(1, 1));
        dbSession.withConnection(() -> {
            Base.exec("UPDATE canonical_queries SET distinct_variant_count = 99, instance_count = 42");
        });

        consistencyMaintainer.recompute(id);

        assertThat(canonical(id).getDistinctVariantCount()).isEqualTo(2);
        assertThat(canonical(id).getInstanceCount()).isEqualTo(2);
    }

    @Test
    void childlessCanonicalCountsZero() {
        long id = insertCanonical(1L, "SELECT $?", "00000000000000000000000000000001", T0);
        dbSession.withConnection(() -> {
            Base.exec("UPDATE canonical_queries SET instance_count = 3 WHERE id_canonical_query = ?", id);
        });

        consistencyMaintainer.recompute(id);

        assertThat(canonical(id).getInstanceCount()).isZero();
    }

    @Test
    void recomputeTargetOnlyTouchesThatTarget() {
        long a = sampleStore.ingest(1L, "SELECT a FROM t", stats(1, 1)).canonicalQueryId();
        long b = sampleStore.ingest(1L, "SELECT b FROM t", stats(1, 1)).canonicalQueryId();
        long other = sampleStore.ingest(2L, "SELECT a FROM t", stats(1, 1)).canonicalQueryId();
        dbSession.withConnection(() -> {
            Base.exec("UPDATE canonical_queries SET distinct_variant_count = 0, instance_count = 0");
        });

        int updated = consistencyMaintainer.recomputeTarget(1L);

        assertThat(updated).isEqualTo(2);
        assertThat(canonical(a).getInstanceCount()).isEqualTo(1);
        assertThat(canonical(b).getDistinctVariantCount()).isEqualTo(1);
        assertThat(canonical(other).getInstanceCount()).isZero();
    }
}
