package dao.fhe.mystery.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ProtocolConfiguration {

    @Bean
    public Clock protocolClock() {
        return Clock.systemUTC();
    }
}
