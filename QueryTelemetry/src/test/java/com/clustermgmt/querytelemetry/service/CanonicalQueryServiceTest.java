package com.clustermgmt.querytelemetry.service;

import com.clustermgmt.querytelemetry.dto.CanonicalQueryFilter;
import com.clustermgmt.querytelemetry.dto.CanonicalQueryStats;
import com.clustermgmt.querytelemetry.dto.CanonicalQueryView;
import com.clustermgmt.querytelemetry.dto.ClassificationRequest;
import com.clustermgmt.querytelemetry.dto.QuerySampleView;
import com.clustermgmt.querytelemetry.exception.ErrorKind;
import com.clustermgmt.querytelemetry.exception.TelemetryException;
import com.clustermgmt.querytelemetry.source.QueryStatistics;
import com.clustermgmt.querytelemetry.support.StoreTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class CanonicalQueryServiceTest extends StoreTestSupport {

    private static final long TARGET = 5L;

    private MonitoringScheduler monitoringScheduler;
    private CanonicalQueryService service;

    private long orders;
    private long users;
    private long discounts;

    @BeforeEach
    void setUp() {
        monitoringScheduler = mock(MonitoringScheduler.class);
        service = new CanonicalQueryService(dbSession, monitoringScheduler, props, clock);

        orders = sampleStore.ingest(TARGET, "SELECT * FROM orders WHERE id IN ($1, $2)", stats(1, 1)).canonicalQueryId();
        clock.advance(Duration.ofDays(1));
        users = sampleStore.ingest(TARGET, "SELECT * FROM Users WHERE name = $1", stats(1, 1)).canonicalQueryId();
        clock.advance(Duration.ofDays(1));
        discounts = sampleStore.ingest(TARGET, "SELECT * FROM t WHERE label = '100%_off'", stats(1, 1)).canonicalQueryId();
    }

    @Test
    void listsMostRecentlySeenFirst() {
        sampleStore.ingest(99L, "SELECT * FROM elsewhere", stats(1, 1));

        assertThat(list(CanonicalQueryFilter.builder()))
            .extracting(CanonicalQueryView::getId)
            .containsExactly(discounts, users, orders);
    }

    @Test
    void listingIsCapped() {
        props.getListing().setMaxResults(2);

        assertThat(list(CanonicalQueryFilter.builder())).hasSize(2);
    }

    @Test
    void filtersOnKnownFlag() {
        service.setClassification(users, ClassificationRequest.builder().isKnown(true).build());

        assertThat(list(CanonicalQueryFilter.builder().knownOnly(true)))
            .extracting(CanonicalQueryView::getId).containsExactly(users);
        assertThat(list(CanonicalQueryFilter.builder().unknownOnly(true)))
            .extracting(CanonicalQueryView::getId).containsExactly(discounts, orders);
    }

    @Test
    void filtersOnGroup() {
        long group = insertGroup(TARGET, "billing");
        service.setClassification(orders, ClassificationRequest.builder().groupId(group).build());

        assertThat(list(CanonicalQueryFilter.builder().groupId(group)))
            .extracting(CanonicalQueryView::getId).containsExactly(orders);
        assertThat(list(CanonicalQueryFilter.builder().ungroupedOnly(true)))
            .extracting(CanonicalQueryView::getId).containsExactly(discounts, users);
    }

    @Test
    void filtersOnInclusiveDays() {
        LocalDate secondDay = LocalDate.of(2026, 3, 2);

        assertThat(list(CanonicalQueryFilter.builder().dateFrom(secondDay).dateTo(secondDay)))
            .extracting(CanonicalQueryView::getId).containsExactly(users);
        assertThat(list(CanonicalQueryFilter.builder().dateFrom(secondDay)))
            .extracting(CanonicalQueryView::getId).containsExactly(discounts, users);
        assertThat(list(CanonicalQueryFilter.builder().dateTo(LocalDate.of(2026, 3, 1))))
            .extracting(CanonicalQueryView::getId).containsExactly(orders);
    }

    @Test
    void textSearchIsCaseInsensitiveAndLiteral() {
        assertThat(list(CanonicalQueryFilter.builder().textSearch("users")))
            .extracting(CanonicalQueryView::getId).containsExactly(users);
        assertThat(list(CanonicalQueryFilter.builder().textSearch("100%_")))
            .extracting(CanonicalQueryView::getId).containsExactly(discounts);
        assertThat(list(CanonicalQueryFilter.builder().textSearch("%"))).hasSize(1);
        assertThat(list(CanonicalQueryFilter.builder().textSearch("_"))).hasSize(1);
    }

    @Test
    void contradictoryFiltersAreRejected() {
        assertThatThrownBy(() -> list(CanonicalQueryFilter.builder().knownOnly(true).unknownOnly(true)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> list(CanonicalQueryFilter.builder().groupId(1L).ungroupedOnly(true)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void classificationChangesOnlyWhatIsGiven() {
        long group = insertGroup(TARGET, "auth");

        CanonicalQueryView grouped = service.setClassification(users,
            ClassificationRequest.builder().isKnown(true).groupId(group).build());
        assertThat(grouped.isKnown()).isTrue();
        assertThat(grouped.getGroupId()).isEqualTo(group);

        CanonicalQueryView ungrouped = service.setClassification(users,
            ClassificationRequest.builder().clearGroup(true).build());
        assertThat(ungrouped.isKnown()).isTrue();
        assertThat(ungrouped.getGroupId()).isNull();
    }

    @Test
    void classificationOfUnknownRowsIsRejected() {
        assertThatThrownBy(() -> service.setClassification(123456L, ClassificationRequest.builder().isKnown(true).build()))
            .isInstanceOf(TelemetryException.class)
            .extracting(e -> ((TelemetryException) e).getKind())
            .isEqualTo(ErrorKind.INVALID_CLASSIFICATION);

        assertThatThrownBy(() -> service.setClassification(users, ClassificationRequest.builder().groupId(987654L).build()))
            .isInstanceOf(TelemetryException.class)
            .hasMessageContaining("987654");
        assertThat(canonical(users).getGroupId()).isNull();
    }

    @Test
    void statsAggregateLiveSamples() {
        sampleStore.ingest(TARGET, "SELECT * FROM orders WHERE id IN ($1, $2, $3)",
            new QueryStatistics(30, 200.0, 0.5, 40.0, 6.6));
        sampleStore.ingest(TARGET, "SELECT * FROM orders WHERE id IN ($1, $2)",
            new QueryStatistics(10, 100.0, 2.0, 20.0, 10.0));

        CanonicalQueryStats stats = service.getStats(orders).orElseThrow();

        assertThat(stats.getSampleCount()).isEqualTo(2);
        assertThat(stats.getTotalCalls()).isEqualTo(40);
        assertThat(stats.getTotalTime()).isEqualTo(300.0);
        assertThat(stats.getAvgTime()).isEqualTo(7.5);
        assertThat(stats.getMinTime()).isEqualTo(0.5);
        assertThat(stats.getMaxTime()).isEqualTo(40.0);
        assertThat(stats.getFirstCollectedAt()).isEqualTo(T0);
        assertThat(stats.getLastUpdatedAt()).isEqualTo(clock.instant());
    }

    @Test
    void statsOfChildlessOrMissingCanonical() {
        long empty = insertCanonical(TARGET, "SELECT $?", "00000000000000000000000000000009", T0);

        CanonicalQueryStats stats = service.getStats(empty).orElseThrow();
        assertThat(stats.getSampleCount()).isZero();
        assertThat(stats.getAvgTime()).isNull();

        assertThat(service.getStats(424242L)).isEqualTo(Optional.empty());
    }

    @Test
    void samplesAreListedNewestFirst() {
        clock.advance(Duration.ofHours(1));
        sampleStore.ingest(TARGET, "SELECT * FROM orders WHERE id IN ($1)", stats(1, 1));

        List<QuerySampleView> samples = service.listSamples(orders);

        assertThat(samples).extracting(QuerySampleView::getRawText)
            .containsExactly("SELECT * FROM orders WHERE id IN ($1)", "SELECT * FROM orders WHERE id IN ($1, $2)");
    }

    @Test
    void purgeRemovesEverythingOfTheTarget() {
        sampleStore.ingest(77L, "SELECT 1", stats(1, 1));

        int deleted = service.purgeTarget(TARGET);

        assertThat(deleted).isEqualTo(3);
        verify(monitoringScheduler).cancelIfRunning(TARGET);
        assertThat(count("SELECT COUNT(*) FROM canonical_queries WHERE id_target = ?", TARGET)).isZero();
        assertThat(count("SELECT COUNT(*) FROM query_samples WHERE id_target = ?", TARGET)).isZero();
        assertThat(count("SELECT COUNT(*) FROM canonical_queries WHERE id_target = ?", 77L)).isEqualTo(1);
    }

    private List<CanonicalQueryView> list(CanonicalQueryFilter.CanonicalQueryFilterBuilder filter) {
        return service.listCanonicalQueries(filter.targetId(TARGET).build());
    }
}
