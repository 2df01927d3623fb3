package energy.p2p.market;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class EnergyMarketApplication {

    public static void main(String[] args) {
        SpringApplication.run(EnergyMarketApplication.class, args);
    }
}
