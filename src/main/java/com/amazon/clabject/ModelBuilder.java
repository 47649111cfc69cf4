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

package com.amazon.clabject;

/**
 * Standard interface for building up configuration and opening a {@link
 * Model} instance. Builders follow a pattern where configuration is supplied
 * via property access methods, so each item can carry its own documentation
 * and optional configuration can be ignored.
 *
 * <p>ModelBuilders are not expected to be thread-safe, but the Models they
 * build are, unless configured otherwise.
 *
 * @author Brian S O'Neill
 */
public interface ModelBuilder {
    /**
     * Builds a model instance, including its root node.
     *
     * @throws ConfigurationException if there is a problem in the builder's configuration
     * @throws ModelException if there is a general problem opening the model
     */
    Model build() throws ConfigurationException, ModelException;

    /**
     * Returns the name of the model to build.
     */
    String getName();

    /**
     * Set name for the model, which is required.
     */
    void setName(String name);
}
