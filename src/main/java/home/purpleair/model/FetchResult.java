package home.purpleair.model;

import home.purpleair.enums.FetchStatus;
import jakarta.annotation.Nullable;

/**
 * Результат одного HTTP запроса к API: тело ответа, отказ по лимиту или ошибка с причиной
 */
public class FetchResult {
    private static final FetchResult THROTTLED = new FetchResult(FetchStatus.THROTTLED, null, null);

    private final FetchStatus status;
    private final byte[] body;
    private final String reason;

    private FetchResult(FetchStatus status, byte[] body, String reason) {
        this.status = status;
        this.body = body;
        this.reason = reason;
    }

    public static FetchResult success(byte[] body) {
        return new FetchResult(FetchStatus.SUCCESS, body, null);
    }

    public static FetchResult throttled() {
        return THROTTLED;
    }

    public static FetchResult failure(String reason) {
        return new FetchResult(FetchStatus.FAILURE, null, reason);
    }

    public FetchStatus getStatus() {
        return status;
    }

    @Nullable
    public byte[] getBody() {
        return body;
    }

    @Nullable
    public String getReason() {
        return reason;
    }
}
