package com.askus.backend;

import com.askus.backend.embedding.AskUsEmbeddingProperties;
import com.askus.backend.llm.AskUsLlmProperties;
import com.askus.backend.prototype.AskUsWeaviateProperties;
import com.askus.backend.routing.RoutingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        RoutingProperties.class,
        AskUsLlmProperties.class,
        AskUsEmbeddingProperties.class,
        AskUsWeaviateProperties.class
})
public class AskUsBackendApplication {
    public static void main(String[] args) {
        SpringApplication.run(AskUsBackendApplication.class, args);
    }
}
