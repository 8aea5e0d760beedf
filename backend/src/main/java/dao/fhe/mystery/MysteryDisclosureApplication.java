package dao.fhe.mystery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MysteryDisclosureApplication {

    public static void main(String[] args) {
        SpringApplication.run(MysteryDisclosureApplication.class, args);
    }
}
