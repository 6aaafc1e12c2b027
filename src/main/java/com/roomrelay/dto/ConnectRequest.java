package com.roomrelay.dto;

import org.springframework.util.MultiValueMap;

/**
 * Handshake parameters of a WebSocket connection to /ws.
 * Any action other than "create" is a join.
 */
public record ConnectRequest(
        String room,
        String username,
        String action,
        String password,
        boolean privateRoom) {

    public static final String ACTION_CREATE = "create";

    public static ConnectRequest fromQueryParams(MultiValueMap<String, String> params) {
        return new ConnectRequest(
                params.getFirst("room"),
                params.getFirst("username"),
                params.getFirst("action"),
                params.getFirst("password"),
                "true".equals(params.getFirst("private")));
    }

    public boolean isCreate() {
        return ACTION_CREATE.equals(action);
    }
}
