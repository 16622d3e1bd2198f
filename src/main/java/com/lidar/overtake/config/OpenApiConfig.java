package com.lidar.overtake.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI overtakeDetectionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Overtake Detection API")
                        .version("1.0.0")
                        .description(
                                "Finds the overtake interval in a lidar distance trace using community detection.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Submit a time-ordered trace via `POST /detections/evaluate`\n" +
                                "2. Build a proximity graph: samples close in value (< ygap) and in time " +
                                "(< xgap, or near an already linked neighbour) are connected\n" +
                                "3. Partition the graph with Louvain modularity optimisation\n" +
                                "4. Pick the largest community whose mean distance is below the low-distance threshold\n" +
                                "5. Drop members deviating from the community median by the outlier tolerance or more\n\n" +
                                "**Graph strategies:**\n" +
                                "- `PROXIMITY`: binary edges from the time/value closeness rule (default)\n" +
                                "- `WEIGHTED`: inverse index/value distance weights\n\n" +
                                "Traces whose graph has no edges yield an empty, degenerate partition.")
                        .contact(new Contact().name("Overtake Detection Team")));
    }
}
