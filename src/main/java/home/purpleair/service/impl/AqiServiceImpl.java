package home.purpleair.service.impl;

import home.purpleair.enums.AqiConversion;
import home.purpleair.enums.Pollutant;
import home.purpleair.model.AqiResult;
import home.purpleair.model.BreakpointTable;
import home.purpleair.service.AqiService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/*
 * Мгновенный AQI, а не усредненный за 10 или 60 минут, как требует методика AirNow:
 * https://www.airnow.gov/sites/default/files/2020-05/aqi-technical-assistance-document-sept2018.pdf
 * При небольших скачках (<20 PM за 10 минут) разница невелика.
 */
@Service
public class AqiServiceImpl implements AqiService {
    private static final Logger logger = LoggerFactory.getLogger(AqiServiceImpl.class);
    private static final double AQANDU_SLOPE = 0.778;
    private static final double AQANDU_INTERCEPT = 2.65;

    @Override
    public double computeAqi(double concentration, BreakpointTable table) {
        if (concentration < 0) {
            logger.debug("Отрицательная концентрация {}, AQI принимаем равным нулю", concentration);
            return 0;
        }

        /* ищем интервал таблицы, в который попадает концентрация */
        double pmLow = 0;
        double aqiLow = 0;
        double pmHigh = 0;
        double aqiHigh = 0;
        for (BreakpointTable.Breakpoint breakpoint : table.getBreakpoints()) {
            if (breakpoint.getConcentration() > concentration) {
                pmHigh = breakpoint.getConcentration();
                aqiHigh = breakpoint.getAqi();
                break;
            }
            pmLow = breakpoint.getConcentration();
            aqiLow = breakpoint.getAqi();
        }
        /* выше последней точки верхняя граница остается (0, 0): верхний интервал продолжается прямой через
        начало координат, пока не упрется в потолок шкалы */

        if (pmHigh == pmLow) {
            return AQI_CEILING;
        }

        double aqi = (aqiHigh - aqiLow) * (concentration - pmLow) / (pmHigh - pmLow) + aqiLow;
        if (aqi > AQI_CEILING) {
            return AQI_CEILING;
        }
        return aqi;
    }

    @Override
    public double aqandu(double pm) {
        return AQANDU_SLOPE * pm + AQANDU_INTERCEPT;
    }

    @Override
    public AqiResult compute(double pm, Pollutant pollutant, AqiConversion conversion) {
        double concentration = conversion == AqiConversion.AQANDU ? aqandu(pm) : pm;
        double aqi = computeAqi(concentration, pollutant.getTable());
        logger.debug("{} {}: концентрация {}, AQI {}", pollutant.getTemplate(), conversion.getTemplate(),
                concentration, aqi);
        return new AqiResult(aqi, conversion);
    }
}
