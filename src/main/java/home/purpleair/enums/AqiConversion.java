package home.purpleair.enums;

public enum AqiConversion {
    NONE("", "без коррекции"),

    AQANDU("AQandU", "с коррекцией AQandU");

    private final String label;

    private final String template;

    AqiConversion(String label, String template) {
        this.label = label;
        this.template = template;
    }

    /**
     * Значение метки conversion в экспортируемых метриках
     */
    public String getLabel() {
        return label;
    }

    public String getTemplate() {
        return template;
    }
}
