package dev.lyceum;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Lyceum lecture Q&amp;A application.
 *
 * <p>Serves the streaming ask endpoint under {@code /api} and exposes the ranking pipeline as MCP
 * tools over the SSE transport.
 */
@SpringBootApplication
public class LyceumApplication {
    public static void main(String[] args) {
        SpringApplication.run(LyceumApplication.class, args);
    }
}
