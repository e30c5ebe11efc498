package home.purpleair.configuration;

import home.purpleair.enums.SchemaVariant;
import jakarta.annotation.PostConstruct;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.time.Duration;

@Configuration
public class PurpleAirConfiguration {
    @Value("${purpleair.variant:LEGACY}")
    private SchemaVariant variant;

    @Value("${purpleair.baseUrl:}")
    private String baseUrl;

    @Value("${purpleair.apiToken:}")
    private String apiToken;

    @Value("${purpleair.connectTimeout:5}")
    private Integer connectTimeoutSeconds;

    @Value("${purpleair.requestTimeout:10}")
    private Integer requestTimeoutSeconds;

    @PostConstruct
    public void validate() {
        if (variant == SchemaVariant.CURRENT && StringUtils.isBlank(apiToken)) {
            throw new IllegalStateException("Для API v1 необходим ключ (PAS_API_TOKEN)");
        }
        if (StringUtils.isBlank(baseUrl)) {
            baseUrl = variant.getDefaultBaseUrl();
        }
        baseUrl = StringUtils.removeEnd(baseUrl.trim(), "/");
    }

    public SchemaVariant getVariant() {
        return variant;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public Duration getConnectTimeout() {
        return Duration.ofSeconds(connectTimeoutSeconds);
    }

    public Duration getRequestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds);
    }

    public URI getSensorUri(String unitId) {
        return variant.buildUri(baseUrl, unitId, apiToken);
    }
}
