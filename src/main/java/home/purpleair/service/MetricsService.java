package home.purpleair.service;

import home.purpleair.enums.Pollutant;
import home.purpleair.model.AqiResult;
import home.purpleair.model.SensorReading;

public interface MetricsService {
    /**
     * Выставляет gauge для каждого присутствующего в показании поля
     *
     * @param reading показание датчика
     */
    void recordReading(SensorReading reading);

    /**
     * Выставляет gauge AQI загрязнителя с меткой коррекции
     *
     * @param reading   показание, из которого посчитан AQI
     * @param pollutant загрязнитель
     * @param result    посчитанный AQI
     */
    void recordAqi(SensorReading reading, Pollutant pollutant, AqiResult result);

    /**
     * Увеличивает счетчик ошибок опроса
     */
    void incrementFetchErrors();
}
