package org.carball.insight.session;

public enum SessionEventType {
    SESSION_START,
    INTENT_CLASSIFICATION,
    DIRECT_DISPATCH,
    SQL_EXECUTION,
    DATA_COMPRESSION,
    API_CALL,
    STAGE_TRANSITION,
    ERROR,
    SESSION_END
}
