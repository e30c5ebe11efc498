package home.purpleair.service;

import home.purpleair.enums.SchemaVariant;
import home.purpleair.exception.SensorParseException;
import home.purpleair.model.SensorReading;

import java.util.List;

public interface SensorParserService {
    /**
     * Разбирает ответ API в список показаний датчиков устройства.
     * Отсутствующие в ответе поля просто не попадают в показание.
     * Корректный JSON без данных дает пустой список.
     *
     * @param unitId  идентификатор устройства, по которому делался запрос
     * @param body    тело ответа
     * @param variant вариант API
     * @return показания в порядке следования в ответе
     * @throws SensorParseException если тело не удалось разобрать как JSON
     */
    List<SensorReading> parse(String unitId, byte[] body, SchemaVariant variant) throws SensorParseException;
}
