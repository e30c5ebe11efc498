package home.purpleair.enums;

public enum PollErrorType {
    TRANSPORT_FAILURE("ошибка получения данных с датчика"),

    PARSE_FAILURE("ошибка разбора ответа датчика");

    private final String template;

    PollErrorType(String template) {
        this.template = template;
    }

    public String getTemplate() {
        return template;
    }
}
