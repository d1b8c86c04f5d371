package dev.tutordesk.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the {@code @Tool} methods of {@link BookToolService} and {@link StudentToolService}
 * as MCP tools:
 *
 * <ul>
 *   <li>{@code books_find}, {@code books_list}, {@code books_get}, {@code books_filter}
 *   <li>{@code books_create}, {@code books_update}, {@code books_delete}
 *   <li>{@code students_list}, {@code students_find}, {@code students_get},
 *       {@code students_filter}
 *   <li>{@code students_create}, {@code students_update}, {@code students_delete}
 * </ul>
 *
 * <p>Spring AI's MCP server auto-configuration picks up the {@link ToolCallbackProvider} bean and
 * exposes each tool over the active transport (stdio or SSE).
 */
@Configuration
public class McpToolConfig {

    @Bean
    public ToolCallbackProvider tutordeskTools(
            BookToolService bookTools, StudentToolService studentTools) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(bookTools, studentTools)
                .build();
    }
}
