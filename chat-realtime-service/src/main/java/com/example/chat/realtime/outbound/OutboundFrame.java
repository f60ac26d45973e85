package com.example.chat.realtime.outbound;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * A serialized frame ready for the transport.
 */
@Getter
@AllArgsConstructor
@ToString
public class OutboundFrame {
    private final String type;
    private final String payload;
    private final FramePriority priority;
}
