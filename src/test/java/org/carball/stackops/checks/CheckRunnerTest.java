package org.carball.stackops.checks;

import org.carball.stackops.cloud.FakeCloudClient;
import org.carball.stackops.config.QueryEngineConfig;
import org.carball.stackops.model.resource.FloatingIp;
import org.carball.stackops.model.resource.LoadBalancer;
import org.carball.stackops.model.resource.Server;
import org.carball.stackops.model.resource.VolumeSnapshot;
import org.carball.stackops.query.QueryFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CheckRunnerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2021-08-01T00:00:00Z"), ZoneOffset.UTC);

    private FakeCloudClient client;
    private LoggingTicketSink sink;
    private CheckRunner runner;

    @BeforeEach
    void setUp() {
        client = new FakeCloudClient()
                .withServers(
                        Server.builder().id("d1").name("web-1").status("DELETING").projectId("p1")
                                .updatedAt("2021-07-31T23:00:00Z").build(),
                        Server.builder().id("d2").name("web-2").status("DELETING").projectId("p1")
                                .updatedAt("2021-07-31T23:55:00Z").build(),
                        Server.builder().id("a1").name("db-1").status("ACTIVE").projectId("p1")
                                .updatedAt("2021-01-01T00:00:00Z").build())
                .withVolumeSnapshots(
                        snapshot("v1", "p1", "2021-05-01T00:00:00Z"),
                        snapshot("v2", "p2", "2021-05-01T00:00:00Z"),
                        snapshot("v3", "p1", "2021-07-20T00:00:00Z"))
                .withFloatingIps(
                        FloatingIp.builder().id("f1").floatingIpAddress("172.24.4.10").status("DOWN")
                                .projectId("p1").updatedAt("2021-07-20T00:00:00Z").build(),
                        FloatingIp.builder().id("f2").floatingIpAddress("172.24.4.11").status("DOWN")
                                .projectId("p1").updatedAt("2021-07-30T00:00:00Z").build(),
                        FloatingIp.builder().id("f3").floatingIpAddress("172.24.4.12").status("ACTIVE")
                                .projectId("p1").updatedAt("2021-07-01T00:00:00Z").build())
                .withLoadBalancers(
                        loadBalancer("lb1", "OFFLINE", "ACTIVE"),
                        loadBalancer("lb2", "ONLINE", "ERROR"),
                        loadBalancer("lb3", "ERROR", "ERROR"),
                        loadBalancer("lb4", "ONLINE", "ACTIVE"));
        sink = new LoggingTicketSink();
        runner = new CheckRunner(new QueryFactory(QueryEngineConfig.defaults(), CLOCK), client, sink, CLOCK);
    }

    private static VolumeSnapshot snapshot(String id, String projectId, String createdAt) {
        return VolumeSnapshot.builder().id(id).name("snap-" + id).size(10).projectId(projectId)
                .createdAt(createdAt).build();
    }

    private static LoadBalancer loadBalancer(String id, String operatingStatus, String provisioningStatus) {
        return LoadBalancer.builder().id(id).name("lb-" + id).projectId("p1").vipAddress("10.0.0.1")
                .operatingStatus(operatingStatus).provisioningStatus(provisioningStatus).build();
    }

    @Test
    void shouldFlagServersStuckDeleting() {
        // When
        List<TicketRequest> tickets = runner.run(CloudCheck.DELETING_MACHINES, CheckParameters.defaults());

        // Then
        assertThat(tickets).singleElement().satisfies(ticket -> {
            assertThat(ticket.getCheck()).isEqualTo("deleting-machines");
            assertThat(ticket.getResourceId()).isEqualTo("d1");
            assertThat(ticket.getTitle())
                    .isEqualTo("Server d1 has not been updated in more than 10 minutes during DELETING");
            assertThat(ticket.getBody()).contains("Server: web-1 (d1)").contains("Project: p1");
            assertThat(ticket.getCreatedAt()).isEqualTo(CLOCK.instant());
            assertThat(ticket.getData()).containsEntry("status", "DELETING");
        });
        assertThat(sink.getSubmitted()).isEqualTo(tickets);
    }

    @Test
    void shouldUseConfiguredDeletingThreshold() {
        QueryEngineConfig config = QueryEngineConfig.defaults().toBuilder().deletingMachineMinutes(2).build();
        CheckRunner eager = new CheckRunner(new QueryFactory(config, CLOCK), client, sink, CLOCK);

        List<TicketRequest> tickets = eager.run(CloudCheck.DELETING_MACHINES, CheckParameters.defaults());

        assertThat(tickets).extracting(TicketRequest::getResourceId).containsExactly("d1", "d2");
    }

    @Test
    void shouldScopeStaleSnapshotsToProjectAndDays() {
        // Given
        CheckParameters parameters = CheckParameters.builder().days(60).projectId("p1").build();

        // When
        List<TicketRequest> tickets = runner.run(CloudCheck.STALE_SNAPSHOTS, parameters);

        // Then
        assertThat(tickets).extracting(TicketRequest::getResourceId).containsExactly("v1");
        assertThat(tickets.get(0).getTitle()).isEqualTo("Snapshot v1 is older than 60 days");
        assertThat(tickets.get(0).getBody()).contains("Size: 10 GB");
    }

    @Test
    void shouldFlagSnapshotsOlderThanDefaultRetention() {
        List<TicketRequest> tickets = runner.run(CloudCheck.STALE_SNAPSHOTS, CheckParameters.defaults());

        assertThat(tickets).extracting(TicketRequest::getResourceId).containsExactly("v1", "v2");
    }

    @Test
    void shouldFlagFloatingIpsDownForAWeek() {
        List<TicketRequest> tickets = runner.run(CloudCheck.DOWN_FLOATING_IPS, CheckParameters.defaults());

        assertThat(tickets).extracting(TicketRequest::getTitle)
                .containsExactly("Floating IP 172.24.4.10 has been DOWN for more than 7 days");
    }

    @Test
    void shouldUnionUnhealthyLoadBalancersById() {
        List<TicketRequest> tickets = runner.run(CloudCheck.UNHEALTHY_LOAD_BALANCERS, CheckParameters.defaults());

        assertThat(tickets).extracting(TicketRequest::getResourceId).containsExactly("lb1", "lb3", "lb2");
        assertThat(tickets.get(0).getTitle()).isEqualTo("Load balancer lb1 is unhealthy (OFFLINE/ACTIVE)");
    }

    @Test
    void shouldSubmitNothingWhenClean() {
        List<TicketRequest> tickets = runner.run(CloudCheck.STALE_SNAPSHOTS,
                CheckParameters.builder().projectId("p7").build());

        assertThat(tickets).isEmpty();
        assertThat(sink.getSubmitted()).isEmpty();
    }

    @Test
    void shouldRenderPlaceholders() {
        Map<String, Object> values = new HashMap<>();
        values.put("id", "s1");
        values.put("name", null);

        assertThat(CheckRunner.render("{id} is {name} at {unknown}", values)).isEqualTo("s1 is null at {unknown}");
        assertThat(CheckRunner.render("cost: $5 for {id}", values)).isEqualTo("cost: $5 for s1");
    }

    @Test
    void shouldResolveChecksByName() {
        assertThat(CloudCheck.fromName("stale-snapshots")).isEqualTo(CloudCheck.STALE_SNAPSHOTS);
        assertThat(CloudCheck.fromName("DOWN_FLOATING_IPS")).isEqualTo(CloudCheck.DOWN_FLOATING_IPS);
        assertThat(CloudCheck.getCheckHelp()).contains("unhealthy-load-balancers");
        assertThatThrownBy(() -> CloudCheck.fromName("noisy-neighbours"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("deleting-machines");
    }
}
