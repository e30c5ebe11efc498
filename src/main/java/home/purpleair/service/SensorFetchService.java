package home.purpleair.service;

import home.purpleair.model.FetchResult;

import java.net.URI;

public interface SensorFetchService {
    /**
     * Выполняет GET запрос к API датчика.
     * Исключения наружу не выбрасываются: любой исход превращается в {@link FetchResult}.
     *
     * @param uri полный URL запроса
     * @return тело ответа, признак ограничения запросов (HTTP 429) или ошибка с причиной
     */
    FetchResult fetch(URI uri);
}
