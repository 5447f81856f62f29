package com.hecsink.spring.autoconfigure;

import com.hecsink.core.pump.SplunkPump;
import com.hecsink.core.pump.SplunkPumpConfig;
import com.hecsink.transport.HecSender;
import com.hecsink.transport.okhttp.OkHttpHecSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(HecSinkProperties.class)
@ConditionalOnProperty(prefix = "hecsink.splunk", name = "collector-url")
public class HecSinkAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(HecSinkAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public SplunkPumpConfig splunkPumpConfig(HecSinkProperties properties) {
        return properties.toPumpConfig().validate();
    }

    @Bean
    @ConditionalOnMissingBean
    public HecSender hecSender(SplunkPumpConfig config) {
        log.info("{} Endpoint: {}", SplunkPump.NAME, config.getCollectorUrl());
        return new OkHttpHecSender(config.toTransportSettings());
    }

    @Bean
    @ConditionalOnMissingBean
    public SplunkPump splunkPump(SplunkPumpConfig config, HecSender hecSender) {
        SplunkPump pump = new SplunkPump(config, hecSender);
        log.debug("{} Initialized", SplunkPump.NAME);
        return pump;
    }
}
