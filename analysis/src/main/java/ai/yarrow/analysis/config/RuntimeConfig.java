package ai.yarrow.analysis.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties("yarrow.runtime")
public class RuntimeConfig {
    private String address;
    private boolean tls = false;

    // per call, empty means no deadline
    private Duration timeout;
}
