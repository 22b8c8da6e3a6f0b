package org.broadinstitute.pileup.utils.logging;

import com.google.common.annotations.VisibleForTesting;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A logger wrapper class which only outputs the first warning provided to it at WARN level.
 * Subsequent warnings go to DEBUG, so repeated conditions stay traceable without flooding the log.
 */
public class OneShotLogger {
    @VisibleForTesting
    Logger logger;
    private boolean hasWarned = false;

    public OneShotLogger(final Class<?> clazz) {
        logger = LogManager.getLogger(clazz);
    }

    public OneShotLogger(final Logger logger) {
        this.logger = logger;
    }

    /*
     * Will write a warning only once for an instance, later messages are demoted to debug
     */
    public void warn(final String message) {
        if (!hasWarned) {
            logger.warn(message);
            hasWarned = true;
        } else {
            logger.debug(message);
        }
    }

    public boolean hasWarned() {
        return hasWarned;
    }
}
