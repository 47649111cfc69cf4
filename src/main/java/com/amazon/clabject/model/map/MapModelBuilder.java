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

package com.amazon.clabject.model.map;

import java.util.Collection;

import com.amazon.clabject.ConfigurationException;
import com.amazon.clabject.Model;
import com.amazon.clabject.ModelException;

import com.amazon.clabject.spi.AbstractModelBuilder;

/**
 * Builds a volatile model, which keeps its whole node graph in memory for the
 * lifetime of the process.
 *
 * <p>
 * The following extra capabilities are supported:
 * <ul>
 * <li>{@link #setRootName root naming}
 * <li>{@link #setLocking optional locking}, for strictly single-threaded use
 * </ul>
 *
 * @author Brian S O'Neill
 */
public class MapModelBuilder extends AbstractModelBuilder {
    /**
     * Convenience method to build a new MapModel.
     */
    public static Model newModel() {
        try {
            MapModelBuilder builder = new MapModelBuilder();
            return builder.build();
        } catch (ModelException e) {
            // Not expected.
            throw new RuntimeException(e);
        }
    }

    private String mName = "";
    private String mRootName = "Root";
    private boolean mLocking = true;

    public MapModelBuilder() {
    }

    public Model build() throws ConfigurationException, ModelException {
        assertReady();
        return new MapModel(this);
    }

    public String getName() {
        return mName;
    }

    public void setName(String name) {
        mName = name;
    }

    /**
     * Returns the display name given to the root node. Default is "Root".
     */
    public String getRootName() {
        return mRootName;
    }

    /**
     * Set the display name given to the root node, which may be null.
     */
    public void setRootName(String name) {
        mRootName = name;
    }

    /**
     * Returns true if the model serializes access with a read-write lock.
     * Default is true.
     */
    public boolean isLocking() {
        return mLocking;
    }

    /**
     * Pass false to build a model without any locking. Such a model must only
     * be accessed by one thread at a time.
     */
    public void setLocking(boolean b) {
        mLocking = b;
    }

    @Override
    public void errorCheck(Collection<String> messages) throws ConfigurationException {
        super.errorCheck(messages);
        if (mRootName != null && mRootName.length() == 0) {
            messages.add("root name cannot be empty");
        }
    }
}
