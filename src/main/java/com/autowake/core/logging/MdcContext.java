package com.autowake.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Autowake-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setService(String serviceName) {
        MDC.put("service", serviceName);
    }

    public static void setModel(String modelName) {
        MDC.put("model", modelName);
    }

    public static void setIdleCycle(long cycle) {
        MDC.put("idleCycle", String.valueOf(cycle));
    }

    public static void clear() {
        MDC.remove("service");
        MDC.remove("model");
        MDC.remove("idleCycle");
    }
}
