package com.manufacturing.semanticlayer.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI semanticLayerOpenAPI() {
        Server localServer = new Server();
        localServer.setUrl("http://localhost:8080");
        localServer.setDescription("Local Development Server");

        Info info = new Info()
                .title("Manufacturing Semantic Layer API")
                .version("0.1.0")
                .description("Deterministic join paths over the schema graph and perspective-driven " +
                        "concept resolution for colliding field names.");

        return new OpenAPI()
                .info(info)
                .servers(List.of(localServer));
    }
}
