package com.sharesgate.access;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Gate check defaults (sharesgate.access).
 */
@ConfigurationProperties(prefix = "sharesgate.access")
@NoArgsConstructor
@Getter
@Setter
public class AccessProperties {

    /** Chain used when a gate check or registration names none. Default "monad". */
    private String defaultChainType = "monad";
}
