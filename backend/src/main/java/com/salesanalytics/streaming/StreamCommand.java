package com.salesanalytics.streaming;

import java.util.Arrays;
import java.util.Optional;

/**
 * Client-to-server commands, sent as {@code {"type": "<command>"}}.
 */
public enum StreamCommand {

    PING("ping"),
    GET_HISTORY("get_history"),
    STOP_STREAMING("stop_streaming");

    private final String type;

    StreamCommand(String type) {
        this.type = type;
    }

    public String getType() {
        return type;
    }

    /**
     * @param type the raw {@code type} field, may be null
     * @return the command, or empty if the type is not recognized
     */
    public static Optional<StreamCommand> fromType(String type) {
        if (type == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(command -> command.type.equals(type))
                .findFirst();
    }
}
