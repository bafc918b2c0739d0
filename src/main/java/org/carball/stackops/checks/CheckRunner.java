package org.carball.stackops.checks;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.carball.stackops.cloud.CloudClient;
import org.carball.stackops.config.QueryEngineConfig;
import org.carball.stackops.model.query.ResultRecord;
import org.carball.stackops.query.Query;
import org.carball.stackops.query.QueryFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs a {@link CloudCheck} and hands one ticket per flagged resource to the sink.
 */
@Slf4j
@RequiredArgsConstructor
public class CheckRunner {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)}");

    private final QueryFactory queryFactory;
    private final CloudClient client;
    private final TicketSink sink;
    private final Clock clock;

    public CheckRunner(QueryFactory queryFactory, CloudClient client, TicketSink sink) {
        this(queryFactory, client, sink, Clock.systemUTC());
    }

    public List<TicketRequest> run(CloudCheck check, CheckParameters parameters) {
        QueryEngineConfig config = queryFactory.getConfig();
        log.info("Running check {}{}", check.getName(),
                parameters.getProjectId() != null ? " for project " + parameters.getProjectId() : "");

        Set<Object> seen = new HashSet<>();
        List<ResultRecord> flagged = new ArrayList<>();
        for (Query<?> query : check.buildQueries(queryFactory, client, config, parameters)) {
            for (ResultRecord record : query.run().toList()) {
                if (seen.add(record.get("id"))) {
                    flagged.add(record);
                }
            }
        }

        String threshold = check.threshold(config, parameters);
        List<TicketRequest> tickets = new ArrayList<>();
        for (ResultRecord record : flagged) {
            tickets.add(toTicket(check, record, threshold));
        }
        log.info("Check {} flagged {} resource(s)", check.getName(), tickets.size());
        sink.submit(tickets);
        return tickets;
    }

    private TicketRequest toTicket(CloudCheck check, ResultRecord record, String threshold) {
        Map<String, Object> values = new LinkedHashMap<>(record.asMap());
        values.put("threshold", threshold);
        Object id = record.get("id");
        return TicketRequest.builder()
                .check(check.getName())
                .resourceId(id == null ? null : id.toString())
                .title(render(check.getTitleTemplate(), values))
                .body(render(check.getBodyTemplate(), values))
                .data(record.asMap())
                .createdAt(clock.instant())
                .build();
    }

    /**
     * Replaces {@code {name}} placeholders with values; unknown placeholders are left as they are.
     */
    static String render(String template, Map<String, Object> values) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder rendered = new StringBuilder();
        while (matcher.find()) {
            String key = matcher.group(1);
            String replacement = values.containsKey(key)
                    ? String.valueOf(values.get(key))
                    : matcher.group(0);
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }
}
