package io.cronhook.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CronhookServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CronhookServerApplication.class, args);
    }
}
