package home.purpleair.event.error;

import home.purpleair.enums.PollErrorType;
import org.springframework.context.ApplicationEvent;

public class SensorPollErrorEvent extends ApplicationEvent {
    String unitId;

    PollErrorType type;

    public SensorPollErrorEvent(Object source, String unitId, PollErrorType type) {
        super(source);
        this.unitId = unitId;
        this.type = type;
    }

    public String getUnitId() {
        return unitId;
    }

    public PollErrorType getType() {
        return type;
    }
}
