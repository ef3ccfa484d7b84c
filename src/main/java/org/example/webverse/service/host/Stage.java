package org.example.webverse.service.host;

/**
 * An independently invocable pipeline step. Stages must answer with a usable
 * response for any payload, including an empty one.
 */
public interface Stage {

    /**
     * Logical name used for named invocation, e.g. {@code writer}.
     */
    String name();

    void handle(StageInbound inbound, StageOutbound outbound);
}
