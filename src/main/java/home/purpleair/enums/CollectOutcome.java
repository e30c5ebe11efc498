package home.purpleair.enums;

/**
 * Итог опроса одного устройства за тик
 */
public enum CollectOutcome {
    COLLECTED("собрано"),

    EMPTY("пусто"),

    THROTTLED("ограничено"),

    FAILED("ошибок");

    private final String template;

    CollectOutcome(String template) {
        this.template = template;
    }

    public String getTemplate() {
        return template;
    }
}
