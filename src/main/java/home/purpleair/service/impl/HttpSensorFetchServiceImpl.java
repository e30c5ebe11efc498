package home.purpleair.service.impl;

import home.purpleair.configuration.PurpleAirConfiguration;
import home.purpleair.model.FetchResult;
import home.purpleair.service.SensorFetchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

@Service
public class HttpSensorFetchServiceImpl implements SensorFetchService {
    public static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final Logger logger = LoggerFactory.getLogger(HttpSensorFetchServiceImpl.class);
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    @Autowired
    public HttpSensorFetchServiceImpl(HttpClient httpClient, PurpleAirConfiguration purpleAirConfiguration) {
        this(httpClient, purpleAirConfiguration.getRequestTimeout());
    }

    public HttpSensorFetchServiceImpl(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public FetchResult fetch(URI uri) {
        logger.debug("Запрашиваем {}", uri);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .build();
        try {
            HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            int statusCode = response.statusCode();
            logger.debug("Ответ {}: код {}", uri, statusCode);

            if (statusCode == HTTP_TOO_MANY_REQUESTS) {
                return FetchResult.throttled();
            }
            if (statusCode < 200 || statusCode >= 300) {
                return FetchResult.failure("HTTP " + statusCode);
            }
            return FetchResult.success(response.body());
        } catch (IOException e) {
            logger.debug("Ошибка запроса {}", uri, e);
            return FetchResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.failure("запрос прерван");
        }
    }
}
