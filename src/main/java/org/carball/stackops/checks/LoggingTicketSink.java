package org.carball.stackops.checks;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes tickets to the log instead of a ticketing system and keeps them for inspection.
 */
@Slf4j
public class LoggingTicketSink implements TicketSink {

    private final List<TicketRequest> submitted = new ArrayList<>();

    @Override
    public void submit(List<TicketRequest> tickets) {
        if (tickets.isEmpty()) {
            log.info("No tickets to raise");
            return;
        }
        for (TicketRequest ticket : tickets) {
            log.info("[{}] {}", ticket.getCheck(), ticket.getTitle());
            log.debug("{}", ticket.getBody());
            submitted.add(ticket);
        }
        log.info("Raised {} ticket(s)", tickets.size());
    }

    public List<TicketRequest> getSubmitted() {
        return List.copyOf(submitted);
    }
}
