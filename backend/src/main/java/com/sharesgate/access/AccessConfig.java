package com.sharesgate.access;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Access gating wiring. The Telegram notifier is the default {@link AccessNotifier}.
 */
@Configuration
@EnableConfigurationProperties({ AccessProperties.class, TelegramProperties.class })
public class AccessConfig {

    @Bean
    @ConditionalOnMissingBean(AccessNotifier.class)
    public AccessNotifier telegramAccessNotifier(WebClient.Builder webClientBuilder, TelegramProperties properties,
                                                 ObjectMapper objectMapper) {
        return new TelegramAccessNotifier(webClientBuilder, properties, objectMapper);
    }
}
