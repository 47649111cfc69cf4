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

import java.util.Collection;

import com.amazon.clabject.ConfigurationException;
import com.amazon.clabject.Model;
import com.amazon.clabject.ModelBuilder;
import com.amazon.clabject.ModelException;

import com.amazon.clabject.spi.AbstractModelBuilder;

/**
 * Builds a model which logs calls to another model. If the log is disabled
 * when build is called, the actual model is returned unwrapped.
 *
 * <pre>
 * MapModelBuilder actual = new MapModelBuilder();
 * actual.setName("products");
 *
 * LoggingModelBuilder builder = new LoggingModelBuilder();
 * builder.setActualModelBuilder(actual);
 * Model model = builder.build();
 * </pre>
 *
 * @author Brian S O'Neill
 */
public class LoggingModelBuilder extends AbstractModelBuilder {
    private String mName;
    private Log mLog;
    private ModelBuilder mModelBuilder;

    public LoggingModelBuilder() {
    }

    public Model build() throws ConfigurationException, ModelException {
        if (mName == null) {
            if (mModelBuilder != null) {
                mName = mModelBuilder.getName();
            }
        }

        assertReady();

        if (mLog == null) {
            mLog = new CommonsLog(LoggingModel.class);
        }

        boolean enabled = mLog.isEnabled();

        String originalName = mModelBuilder.getName();
        Model actual;
        try {
            if (enabled) {
                mModelBuilder.setName("Logging " + mName);
            }
            actual = mModelBuilder.build();
        } finally {
            mModelBuilder.setName(originalName);
        }

        if (!enabled) {
            return actual;
        }

        return new LoggingModel(actual, mLog);
    }

    public void setName(String name) {
        mName = name;
    }

    public String getName() {
        return mName;
    }

    /**
     * Set the Log to use. If null, use default. Log must be enabled when build
     * is called, or else no logging is ever performed.
     */
    public void setLog(Log log) {
        mLog = log;
    }

    /**
     * Return the Log to use. If null, use default.
     */
    public Log getLog() {
        return mLog;
    }

    /**
     * Set the builder of the model to wrap all calls to.
     */
    public void setActualModelBuilder(ModelBuilder builder) {
        mModelBuilder = builder;
    }

    /**
     * Returns the builder of the model that all calls are wrapped to.
     */
    public ModelBuilder getActualModelBuilder() {
        return mModelBuilder;
    }

    @Override
    public void errorCheck(Collection<String> messages) throws ConfigurationException {
        super.errorCheck(messages);
        if (mModelBuilder == null) {
            messages.add("Actual model builder must be set");
        }
    }
}
