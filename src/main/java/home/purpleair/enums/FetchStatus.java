package home.purpleair.enums;

public enum FetchStatus {
    SUCCESS("ответ получен"),

    THROTTLED("запрос ограничен сервером (HTTP 429)"),

    FAILURE("ошибка запроса");

    private final String template;

    FetchStatus(String template) {
        this.template = template;
    }

    public String getTemplate() {
        return template;
    }
}
