package org.carball.stackops.checks;

import java.util.List;

/**
 * Destination for tickets raised by checks.
 */
public interface TicketSink {

    void submit(List<TicketRequest> tickets);
}
