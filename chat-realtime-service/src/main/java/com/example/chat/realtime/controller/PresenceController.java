package com.example.chat.realtime.controller;

import com.example.chat.realtime.dto.PresenceResponse;
import com.example.chat.realtime.session.SessionRegistry;
import com.example.chat.shared.config.AppProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
public class PresenceController {

    private final SessionRegistry sessionRegistry;
    private final AppProperties appProperties;

    @GetMapping("/presence/{userId}")
    public ResponseEntity<PresenceResponse> presence(@PathVariable String userId) {
        int connections = sessionRegistry.connectionsFor(userId).size();
        return ResponseEntity.ok(new PresenceResponse(userId, connections > 0, connections));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("podId", appProperties.getPod().getId());
        stats.put("connections", sessionRegistry.getConnectionCount());
        stats.put("onlineUsers", sessionRegistry.getOnlineUserCount());
        stats.put("activeRooms", sessionRegistry.getRoomCount());
        stats.put("timestamp", OffsetDateTime.now(ZoneOffset.UTC).toString());
        return ResponseEntity.ok(stats);
    }
}
