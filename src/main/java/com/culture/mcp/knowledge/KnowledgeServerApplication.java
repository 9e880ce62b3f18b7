package com.culture.mcp.knowledge;

import com.culture.mcp.knowledge.mcp.KnowledgeSearchTools;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class KnowledgeServerApplication {

	public static void main(String[] args) {
		SpringApplication.run(KnowledgeServerApplication.class, args);
	}

	@Bean
	public ToolCallbackProvider tools(KnowledgeSearchTools searchTools) {
		return MethodToolCallbackProvider.builder()
				.toolObjects(searchTools)
				.build();
	}

}
