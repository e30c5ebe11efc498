package home.purpleair.service;

import home.purpleair.enums.CollectOutcome;

public interface CollectorService {
    /**
     * Опрашивает одно устройство и выставляет метрики по всем его датчикам.
     * Ошибки опроса обрабатываются внутри и наружу не выходят.
     *
     * @param unitId идентификатор устройства из конфигурации
     * @return итог опроса устройства
     */
    CollectOutcome collect(String unitId);

    /**
     * Последовательно опрашивает все устройства из конфигурации и пишет в лог итог тика
     */
    void collectAll();
}
