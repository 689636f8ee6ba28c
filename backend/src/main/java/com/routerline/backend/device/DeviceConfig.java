package com.routerline.backend.device;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.time.Clock;

@Configuration
public class DeviceConfig {

    @Bean
    @ConditionalOnMissingBean(DeviceTransportFactory.class)
    public DeviceTransportFactory restDeviceTransportFactory(RestClient.Builder builder, ObjectMapper om) {
        return new RestDeviceTransportFactory(builder, om);
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock systemClock() {
        return Clock.systemUTC();
    }
}
