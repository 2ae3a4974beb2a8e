package org.gc.socialpublisher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableAsync
@EnableScheduling
@SpringBootApplication
@EnableFeignClients
public class SocialPublisherApplication {

    public static void main(String[] args) {
        SpringApplication.run(SocialPublisherApplication.class, args);
    }

}
