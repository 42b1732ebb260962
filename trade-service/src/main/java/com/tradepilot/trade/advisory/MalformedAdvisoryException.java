package com.tradepilot.trade.advisory;

import com.tradepilot.common.exception.EngineException;

/**
 * The advisory service answered, but not with something the engine can use.
 */
public class MalformedAdvisoryException extends EngineException {

    public MalformedAdvisoryException(String message) {
        super("AdvisoryValidator", message);
    }
}
