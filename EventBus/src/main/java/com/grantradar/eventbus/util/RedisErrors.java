package com.grantradar.eventbus.util;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;

/**
 * Classification of broker failures surfaced through Spring's
 * DataAccessException hierarchy.
 */
public final class RedisErrors {

    public static final String BUSYGROUP = "BUSYGROUP";
    public static final String NOGROUP = "NOGROUP";

    private RedisErrors() {
    }

    /**
     * True when any exception in the cause chain is a broker reply starting with the given error code.
     */
    public static boolean hasErrorCode(Throwable error, String code) {
        for (Throwable t : ExceptionUtils.getThrowableList(error)) {
            if (StringUtils.startsWith(t.getMessage(), code)) {
                return true;
            }
        }
        return false;
    }

    /** Network or broker unavailability, worth retrying. */
    public static boolean isTransient(Throwable error) {
        return ExceptionUtils.indexOfType(error, RedisConnectionFailureException.class) >= 0
                || ExceptionUtils.indexOfType(error, QueryTimeoutException.class) >= 0;
    }
}
