package com.sharesgate.access;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Telegram Bot API client settings (sharesgate.telegram). Bot tokens are stored per community.
 */
@ConfigurationProperties(prefix = "sharesgate.telegram")
@NoArgsConstructor
@Getter
@Setter
public class TelegramProperties {

    private String apiBaseUrl = "https://api.telegram.org";

    private Duration requestTimeout = Duration.ofSeconds(10);
}
