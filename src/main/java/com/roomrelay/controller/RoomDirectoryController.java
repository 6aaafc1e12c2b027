package com.roomrelay.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.roomrelay.config.RelayProperties;
import com.roomrelay.dto.DirectoryResponse;
import com.roomrelay.dto.ErrorResponse.ErrorCode;
import com.roomrelay.service.RoomRegistry;
import com.roomrelay.service.RoomSecurityService;

/**
 * Read-only discovery of public rooms.
 */
@RestController
public class RoomDirectoryController {

    private static final Logger logger = LoggerFactory.getLogger(RoomDirectoryController.class);

    private final RoomRegistry registry;
    private final RoomSecurityService securityService;
    private final RelayProperties properties;

    public RoomDirectoryController(RoomRegistry registry,
                                   RoomSecurityService securityService,
                                   RelayProperties properties) {
        this.registry = registry;
        this.securityService = securityService;
        this.properties = properties;
    }

    /**
     * List public rooms with their live member counts.
     * GET /rooms?token=...
     *
     * @return 200 with {"rooms":[...]}, or 401 without body if the token is missing or wrong
     */
    @GetMapping(value = "/rooms", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DirectoryResponse> listRooms(
            @RequestParam(value = "token", required = false) String token) {

        if (!securityService.tokenMatches(token, properties.getDirectory().getToken())) {
            logger.debug("Directory request rejected ({})", ErrorCode.AUTH_006.getCode());
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        return ResponseEntity.ok(new DirectoryResponse(registry.listPublicRooms()));
    }
}
