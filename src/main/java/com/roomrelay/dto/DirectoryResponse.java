package com.roomrelay.dto;

import java.util.List;

/**
 * Body of GET /rooms
 */
public record DirectoryResponse(List<RoomInfo> rooms) {
}
