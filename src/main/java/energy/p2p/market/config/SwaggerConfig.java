package energy.p2p.market.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation for the market API
 */
@Configuration
public class SwaggerConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Energy Market API")
                        .description("Peer-to-peer energy market. Buy orders are matched first-fit against "
                                + "sell orders of equal quantity and settled at the seller's price. "
                                + "Caller identity is passed in the X-Participant-Id header.")
                        .version("1.0.0"))
                .servers(List.of(new Server()
                        .url("http://localhost:" + serverPort)
                        .description("Local Development Server")));
    }
}
