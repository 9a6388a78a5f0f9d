package com.blogicum.infrastructure.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.HeaderParameter;
import org.springdoc.core.customizers.OperationCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    private static final String EXAMPLE_USER_ID = "0190c6e2-7a8b-7c3d-9e4f-123456789abc";

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Blogicum API")
                        .version("1.0")
                        .description("Posts, categories, comments and author profiles"));
    }

    /**
     * The acting user is read by the auth filter rather than by the controllers, so the header
     * is documented on every operation here.
     */
    @Bean
    public OperationCustomizer addActingUserHeader() {
        return (operation, handlerMethod) -> {
            StringSchema schema = new StringSchema();
            schema.setExample(EXAMPLE_USER_ID);
            operation.addParametersItem(new HeaderParameter()
                    .name("X-User-Id")
                    .required(false)
                    .description("Acting user; omit for anonymous requests")
                    .schema(schema));
            return operation;
        };
    }
}
