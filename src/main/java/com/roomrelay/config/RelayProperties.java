package com.roomrelay.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the relay
 * Binds to relay.* properties in application.yml
 */
@Configuration
@ConfigurationProperties(prefix = "relay")
@Validated
public class RelayProperties {

    @NotBlank
    private String defaultRoom = "default";

    @Valid
    private Directory directory = new Directory();

    @Valid
    private Security security = new Security();

    @Valid
    private WebSocket websocket = new WebSocket();

    // Getters and setters
    public String getDefaultRoom() {
        return defaultRoom;
    }

    public void setDefaultRoom(String defaultRoom) {
        this.defaultRoom = defaultRoom;
    }

    public Directory getDirectory() {
        return directory;
    }

    public void setDirectory(Directory directory) {
        this.directory = directory;
    }

    public Security getSecurity() {
        return security;
    }

    public void setSecurity(Security security) {
        this.security = security;
    }

    public WebSocket getWebsocket() {
        return websocket;
    }

    public void setWebsocket(WebSocket websocket) {
        this.websocket = websocket;
    }

    /**
     * Room directory endpoint settings
     */
    public static class Directory {
        @NotBlank
        private String token = "public-chat-token";

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }
    }

    /**
     * Room password hashing settings
     */
    public static class Security {
        // BCryptPasswordEncoder accepts 4..31
        @Min(4)
        @Max(31)
        private int bcryptStrength = 10;

        public int getBcryptStrength() {
            return bcryptStrength;
        }

        public void setBcryptStrength(int bcryptStrength) {
            this.bcryptStrength = bcryptStrength;
        }
    }

    /**
     * WebSocket transport settings
     */
    public static class WebSocket {
        @NotBlank
        private String path = "/ws";

        // Frames queued per client before a write counts as failed
        @Min(1)
        private int outboundBufferSize = 256;

        @Min(1024)
        private int maxFramePayloadLength = 64 * 1024;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public int getOutboundBufferSize() {
            return outboundBufferSize;
        }

        public void setOutboundBufferSize(int outboundBufferSize) {
            this.outboundBufferSize = outboundBufferSize;
        }

        public int getMaxFramePayloadLength() {
            return maxFramePayloadLength;
        }

        public void setMaxFramePayloadLength(int maxFramePayloadLength) {
            this.maxFramePayloadLength = maxFramePayloadLength;
        }
    }
}
