package dev.tutordesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the TutorDesk MCP tool server.
 *
 * <p>Supports two Spring profiles: {@code web} (MCP SSE on port 8080) and {@code stdio} (MCP
 * stdio transport, no web server).
 */
@SpringBootApplication
public class TutorDeskApplication {
    public static void main(String[] args) {
        SpringApplication.run(TutorDeskApplication.class, args);
    }
}
