package tech.footprint.breach_api.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Breach API")
                        .version("1.0.0")
                        .description("Hashed-email breach membership and k-anonymity password ranges")
                        .contact(new Contact()
                                .name("Footprint")
                                .email("contact@footprint.tech")
                                .url("https://footprint.tech"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0.html")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8090")
                                .description("Development server")))
                .tags(List.of(
                        new Tag().name("Breach").description("Email and password lookups"),
                        new Tag().name("Catalog").description("Known breaches and cache statistics"),
                        new Tag().name("Import").description("Cache ingestion")));
    }
}
