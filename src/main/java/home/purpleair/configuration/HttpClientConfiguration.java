package home.purpleair.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;

@Configuration
public class HttpClientConfiguration {
    @Bean
    public HttpClient purpleAirHttpClient(PurpleAirConfiguration purpleAirConfiguration) {
        return HttpClient.newBuilder()
                .connectTimeout(purpleAirConfiguration.getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }
}
