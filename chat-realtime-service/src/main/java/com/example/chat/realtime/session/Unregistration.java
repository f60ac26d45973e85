package com.example.chat.realtime.session;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Set;

/**
 * Outcome of removing a connection from the registry. {@code presenceRooms} is only
 * populated on the {@link PresenceTransition#OFFLINE} edge and lists every room the
 * identity had announced itself in while online.
 */
@Getter
@AllArgsConstructor
@ToString
public class Unregistration {

    private static final Unregistration UNKNOWN = new Unregistration(null, PresenceTransition.NONE, Set.of());

    private final String userId;
    private final PresenceTransition transition;
    private final Set<String> presenceRooms;

    public static Unregistration unknown() {
        return UNKNOWN;
    }

    public boolean wentOffline() {
        return transition == PresenceTransition.OFFLINE;
    }
}
