package home.purpleair.service;

import home.purpleair.enums.AqiConversion;
import home.purpleair.enums.Pollutant;
import home.purpleair.model.AqiResult;
import home.purpleair.model.BreakpointTable;

public interface AqiService {
    /**
     * Верхняя граница шкалы AQI
     */
    double AQI_CEILING = 500;

    /**
     * Переводит концентрацию частиц в мгновенный AQI по таблице опорных точек.
     * Значения выше шкалы обрезаются до 500, отрицательные концентрации дают 0.
     *
     * @param concentration концентрация, мкг/м³
     * @param table         таблица опорных точек загрязнителя
     * @return AQI с плавающей точкой
     */
    double computeAqi(double concentration, BreakpointTable table);

    /**
     * Линейная коррекция показаний датчиков PurpleAir по методике AQandU (Университет Юты)
     *
     * @param pm сырая концентрация, мкг/м³
     * @return скорректированная концентрация, без ограничений снизу
     */
    double aqandu(double pm);

    /**
     * Считает AQI загрязнителя с заданной коррекцией
     *
     * @param pm         сырая концентрация, мкг/м³
     * @param pollutant  загрязнитель
     * @param conversion применяемая коррекция
     * @return AQI вместе с признаком коррекции
     */
    AqiResult compute(double pm, Pollutant pollutant, AqiConversion conversion);
}
