package com.itinera.server.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Collections;

/**
 * SpringDoc OpenAPI 文档配置，页面为 /swagger-ui.html，描述为 /v3/api-docs。
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI itineraOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Itinera 行程构建接口文档")
                        .description("根据候选地点、预算与出行偏好生成逐日行程，并在超预算时自动重排")
                        .version("v1"))
                .servers(Collections.singletonList(
                        new Server().url("/").description("默认服务端")
                ));
    }
}
