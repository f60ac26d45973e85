package com.example.chat.realtime.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class PresenceResponse {
    private String userId;
    private boolean online;
    private int connections;
}
