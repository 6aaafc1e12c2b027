package com.roomrelay.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Directory entry for one public room
 */
public record RoomInfo(
        String name,
        @JsonProperty("hasPass") boolean hasPassword,
        int userCount) {
}
