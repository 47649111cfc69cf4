/*
 * Copyright 2006 Amazon Technologies, Inc. or its affiliates.
 * Amazon, Amazon.com and Carbonado are trademarks or registered trademarks
 * of Amazon Technologies, Inc. or its affiliates.  All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.amazon.clabject.model.logging;

/**
 * Log implementation which writes model calls to Apache Commons Logging at
 * debug level. This is the default used by {@link LoggingModelBuilder}.
 *
 * @author Brian S O'Neill
 */
public class CommonsLog implements Log {
    private final org.apache.commons.logging.Log mLog;

    public CommonsLog(org.apache.commons.logging.Log log) {
        if (log == null) {
            throw new IllegalArgumentException("Commons Log cannot be null");
        }
        mLog = log;
    }

    public CommonsLog(Class<?> clazz) {
        this(org.apache.commons.logging.LogFactory.getLog(clazz));
    }

    /**
     * @param category logging category, typically one per model
     */
    public CommonsLog(String category) {
        this(org.apache.commons.logging.LogFactory.getLog(category));
    }

    public boolean isEnabled() {
        return mLog.isDebugEnabled();
    }

    public void write(String message) {
        mLog.debug(message);
    }
}
