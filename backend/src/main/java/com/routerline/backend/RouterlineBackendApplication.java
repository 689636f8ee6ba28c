package com.routerline.backend;

import com.routerline.backend.device.RouterlineDeviceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        RouterlineDeviceProperties.class
})
public class RouterlineBackendApplication {
    public static void main(String[] args) {
        SpringApplication.run(RouterlineBackendApplication.class, args);
    }
}
