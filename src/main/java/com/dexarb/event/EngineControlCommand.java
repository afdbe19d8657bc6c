package com.dexarb.event;

import lombok.Value;

/**
 * Inbound command from the dashboard side. Publish it as an application event.
 */
@Value
public class EngineControlCommand {

    public enum Action {
        PAUSE, RESUME
    }

    Action action;
    String reason;
}
