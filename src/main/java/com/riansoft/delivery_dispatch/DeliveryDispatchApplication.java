package com.riansoft.delivery_dispatch;

import com.riansoft.delivery_dispatch.config.DispatchProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(DispatchProperties.class)
public class DeliveryDispatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeliveryDispatchApplication.class, args);
    }
}
