package com.subagent.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Two ways to run:
 * <pre>
 *   build:  ANTHROPIC_API_KEY=sk-ant-... java -jar gateway.jar --spring.profiles.active=build
 *   serve:  ANTHROPIC_API_KEY=sk-ant-... java -jar gateway.jar
 * </pre>
 * The build groups the tool catalog and writes the result; serving loads it
 * and exposes one MCP tool per group at POST /mcp.
 */
@SpringBootApplication
public class GatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
    }
}
