package org.carball.stackops.query;

import org.carball.stackops.cloud.FakeCloudClient;
import org.carball.stackops.model.property.AuxiliaryData;
import org.carball.stackops.model.property.VolumeSnapshotProperties;
import org.carball.stackops.model.query.ResultRecord;
import org.carball.stackops.model.query.SortOrder;
import org.carball.stackops.model.resource.Project;
import org.carball.stackops.model.resource.VolumeSnapshot;
import org.carball.stackops.query.mapping.VolumeSnapshotQueryMapping;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryOutputTest {

    private final VolumeSnapshot small = snapshot("v1", "nightly", 5, "p1");
    private final VolumeSnapshot large = snapshot("v2", "weekly", 120, "p2");
    private final VolumeSnapshot unsized = snapshot("v3", "manual", null, "p1");
    private final VolumeSnapshot orphan = snapshot("v4", "orphan", 40, null);

    private QueryOutput<VolumeSnapshot> output;

    @BeforeEach
    void setUp() {
        output = new QueryOutput<>(new VolumeSnapshotQueryMapping(Clock.systemUTC()));
    }

    private static VolumeSnapshot snapshot(String id, String name, Integer size, String projectId) {
        return VolumeSnapshot.builder().id(id).name(name).size(size).projectId(projectId).build();
    }

    @Test
    void shouldUseDefaultPropertiesWhenNothingSelected() {
        QueryResult result = output.project(List.of(small), AuxiliaryData.NONE);

        assertThat(result.getColumns()).containsExactly("id", "name");
        assertThat(result.toList()).containsExactly(new ResultRecord(Map.of("id", "v1", "name", "nightly")));
        assertThat(result.isGrouped()).isFalse();
    }

    @Test
    void shouldProjectSelectedPropertiesInOrderWithoutDuplicates() {
        // When
        QueryResult result = output
                .select(VolumeSnapshotProperties.SNAPSHOT_SIZE, VolumeSnapshotProperties.SNAPSHOT_ID)
                .select("snapshot_size", "name")
                .project(List.of(small), AuxiliaryData.NONE);

        // Then
        assertThat(result.getColumns()).containsExactly("size", "id", "name");
        assertThat(result.toList().get(0).propertyNames()).containsExactly("size", "id", "name");
    }

    @Test
    void shouldSelectAllProperties() {
        QueryResult result = output.selectAll().project(List.of(small), AuxiliaryData.NONE);

        assertThat(result.getColumns()).hasSize(VolumeSnapshotProperties.values().length);
    }

    @Test
    void shouldSortNumericallyWithNullsLast() {
        QueryResult ascending = output.select(VolumeSnapshotProperties.SNAPSHOT_ID)
                .sortBy(VolumeSnapshotProperties.SNAPSHOT_SIZE, SortOrder.ASC)
                .project(List.of(large, unsized, small, orphan), AuxiliaryData.NONE);

        assertThat(ascending.toList()).extracting(record -> record.get("id")).containsExactly("v1", "v4", "v2", "v3");

        QueryResult descending = output.sortBy("size", SortOrder.DESC)
                .project(List.of(large, unsized, small, orphan), AuxiliaryData.NONE);

        assertThat(descending.toList()).extracting(record -> record.get("id")).containsExactly("v2", "v4", "v1", "v3");
    }

    @Test
    void shouldGroupRecordsInFirstSeenOrder() {
        // When
        QueryResult result = output.select(VolumeSnapshotProperties.SNAPSHOT_ID)
                .groupBy(VolumeSnapshotProperties.PROJECT_ID)
                .project(List.of(large, small, orphan, unsized), AuxiliaryData.NONE);

        // Then
        Map<String, List<ResultRecord>> groups = result.toGroups();
        assertThat(result.getGroupedBy()).isEqualTo("project_id");
        assertThat(groups).containsOnlyKeys("p2", "p1", QueryOutput.NO_GROUP);
        assertThat(groups.keySet()).containsExactly("p2", "p1", "(none)");
        assertThat(groups.get("p1")).extracting(record -> record.get("id")).containsExactly("v1", "v3");
        assertThat(groups.values().stream().mapToInt(List::size).sum()).isEqualTo(result.size());
    }

    @Test
    void shouldGroupByDerivedProperty() {
        // Given
        FakeCloudClient client = new FakeCloudClient()
                .withProjects(Project.builder().id("p1").name("alpha").build());
        LookupContext lookups = LookupContext.forClient(client);

        // When
        QueryResult result = output.select("id", "project_name")
                .groupBy("project_name")
                .project(List.of(small, unsized, large), lookups);

        // Then
        assertThat(result.toGroups()).containsOnlyKeys("alpha", "(none)");
        assertThat(result.toList()).extracting(record -> record.get("project_name"))
                .containsExactly("alpha", "alpha", null);
        assertThat(lookups.getFailures()).hasSize(1);
    }

    @Test
    void shouldTreatEmptyKeyAsNoGroup() {
        assertThat(QueryOutput.groupKey(null)).isEqualTo(QueryOutput.NO_GROUP);
        assertThat(QueryOutput.groupKey("")).isEqualTo(QueryOutput.NO_GROUP);
        assertThat(QueryOutput.groupKey(7)).isEqualTo("7");
    }

    @Test
    void ungroupedResultShouldRefuseGroups() {
        QueryResult result = output.project(List.of(), AuxiliaryData.NONE);

        assertThat(result.isEmpty()).isTrue();
        assertThatThrownBy(result::toGroups).isInstanceOf(IllegalStateException.class);
    }
}
