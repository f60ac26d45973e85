package com.example.chat.realtime.controller;

import com.example.chat.realtime.dto.InviteRequest;
import com.example.chat.realtime.dto.TournamentAnnounceRequest;
import com.example.chat.realtime.notify.NotificationRelay;
import com.example.chat.realtime.notify.TournamentAnnouncement;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Entry points for the match and tournament services. Responses report how many live
 * connections were reached; offline users simply get 0.
 */
@RestController
@RequestMapping("/api/internal/notifications")
@RequiredArgsConstructor
@Slf4j
public class InternalNotificationController {

    private final NotificationRelay notificationRelay;

    @PostMapping("/invite")
    public ResponseEntity<Map<String, Object>> invite(@Valid @RequestBody InviteRequest request) {
        log.info("Match invite {} from {} to {}", request.getMatchId(), request.getFromUserId(), request.getToUserId());
        int delivered = notificationRelay.sendInvite(request.getToUserId(), request.getFromUserId(), request.getMatchId());
        return ResponseEntity.ok(Map.of("userId", request.getToUserId(), "deliveredConnections", delivered));
    }

    @PostMapping("/tournament-announce")
    public ResponseEntity<Map<String, Object>> tournamentAnnounce(@Valid @RequestBody TournamentAnnounceRequest request) {
        log.info("Tournament match {} announced: {} vs {}", request.getMatchId(), request.getP1(), request.getP2());
        Map<String, Integer> delivered = notificationRelay.announceTournamentMatch(new TournamentAnnouncement(
                request.getMatchId(), request.getP1(), request.getP2(), request.getEta()));
        return ResponseEntity.ok(Map.of("matchId", request.getMatchId(), "deliveredConnections", delivered));
    }
}
