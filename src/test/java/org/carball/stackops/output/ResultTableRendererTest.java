package org.carball.stackops.output;

import org.carball.stackops.model.property.AuxiliaryData;
import org.carball.stackops.model.property.ServerProperties;
import org.carball.stackops.model.resource.Server;
import org.carball.stackops.query.QueryOutput;
import org.carball.stackops.query.QueryResult;
import org.carball.stackops.query.mapping.ServerQueryMapping;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResultTableRendererTest {

    private final List<Server> servers = List.of(
            Server.builder().id("s1").name("web-1").status("ERROR").projectId("p1").build(),
            Server.builder().id("s22").status("SHUTOFF").projectId("p2").build(),
            Server.builder().id("s3").name("db").status("ERROR").projectId("p1").build());

    private static QueryOutput<Server> output() {
        return new QueryOutput<Server>(new ServerQueryMapping(Clock.systemUTC()))
                .select(ServerProperties.SERVER_ID, ServerProperties.SERVER_NAME, ServerProperties.SERVER_STATUS);
    }

    @Test
    void shouldRenderGridTable() {
        // Given
        QueryResult result = output().project(servers.subList(0, 2), AuxiliaryData.NONE);

        // When
        String table = new ResultTableRenderer(ResultTableRenderer.Style.GRID).render(result);

        // Then
        assertThat(table).isEqualTo(
                "+-----+-------+---------+\n"
                        + "| id  | name  | status  |\n"
                        + "+-----+-------+---------+\n"
                        + "| s1  | web-1 | ERROR   |\n"
                        + "| s22 |       | SHUTOFF |\n"
                        + "+-----+-------+---------+\n");
    }

    @Test
    void shouldRenderPlainTable() {
        QueryResult result = output().project(servers.subList(0, 2), AuxiliaryData.NONE);

        String table = new ResultTableRenderer(ResultTableRenderer.Style.PLAIN).render(result);

        assertThat(table).isEqualTo(
                "id   name   status\n"
                        + "s1   web-1  ERROR\n"
                        + "s22         SHUTOFF\n");
    }

    @Test
    void shouldRenderHeaderOnlyForEmptyResult() {
        QueryResult result = output().project(List.of(), AuxiliaryData.NONE);

        assertThat(result.toTable(true)).isEqualTo(
                "+----+------+--------+\n"
                        + "| id | name | status |\n"
                        + "+----+------+--------+\n");
    }

    @Test
    void shouldRenderOneTablePerGroup() {
        // Given
        QueryResult result = output().groupBy(ServerProperties.PROJECT_ID).project(servers, AuxiliaryData.NONE);

        // When
        String table = result.toTable(false);

        // Then
        assertThat(table).isEqualTo(
                "project_id: p1 (2)\n"
                        + "id  name   status\n"
                        + "s1  web-1  ERROR\n"
                        + "s3  db     ERROR\n"
                        + "\n"
                        + "project_id: p2 (1)\n"
                        + "id   name  status\n"
                        + "s22        SHUTOFF\n");
    }

    @Test
    void shouldRenderNullAsEmptyCell() {
        assertThat(ResultTableRenderer.cell(null)).isEmpty();
        assertThat(ResultTableRenderer.cell(42)).isEqualTo("42");
    }
}
