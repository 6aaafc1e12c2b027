package com.roomrelay;

import java.net.InetAddress;
import java.net.NetworkInterface;
import java.util.Enumeration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.reactive.ReactiveUserDetailsServiceAutoConfiguration;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;

import com.roomrelay.config.RelayProperties;

/**
 * Main application class for RoomRelay
 *
 * Clients connect to /ws with a room name, optionally creating it with a password or
 * as a private room, and receive every message sent to that room. Public rooms are
 * listed at /rooms.
 */
@SpringBootApplication(exclude = ReactiveUserDetailsServiceAutoConfiguration.class)
public class RoomRelayApplication {

	private static final Logger logger = LoggerFactory.getLogger(RoomRelayApplication.class);

	private final RelayProperties properties;

	public RoomRelayApplication(RelayProperties properties) {
		this.properties = properties;
	}

	public static void main(String[] args) {
		SpringApplication.run(RoomRelayApplication.class, args);
	}

	@EventListener
	public void onServerStarted(WebServerInitializedEvent event) {
		int port = event.getWebServer().getPort();
		String path = properties.getWebsocket().getPath();

		logger.info("=================================");
		logger.info("RoomRelay Server Started");
		logger.info("WebSocket: ws://localhost:{}{}", port, path);
		logger.info("Directory: http://localhost:{}/rooms?token=...", port);

		// Show network IP address for access from other devices
		String networkIp = getNetworkIp();
		if (networkIp != null) {
			logger.info("Network access: ws://{}:{}{}", networkIp, port, path);
		}
		logger.info("=================================");
	}

	/**
	 * Gets the site-local IPv4 address other devices on the LAN can use
	 * @return Network IP address or null if not found
	 */
	private String getNetworkIp() {
		try {
			Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
			while (interfaces.hasMoreElements()) {
				NetworkInterface networkInterface = interfaces.nextElement();

				// Skip loopback and non-active interfaces
				if (networkInterface.isLoopback() || !networkInterface.isUp()) {
					continue;
				}

				Enumeration<InetAddress> addresses = networkInterface.getInetAddresses();
				while (addresses.hasMoreElements()) {
					InetAddress address = addresses.nextElement();
					if (!address.isLoopbackAddress() && address.isSiteLocalAddress()) {
						return address.getHostAddress();
					}
				}
			}
		} catch (Exception e) {
			logger.debug("Error detecting network IP: {}", e.getMessage());
		}
		return null;
	}
}
