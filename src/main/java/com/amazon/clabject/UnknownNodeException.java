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
 * Thrown when an operation references a node which is not present in the
 * model.
 *
 * @author Brian S O'Neill
 */
public class UnknownNodeException extends ModelException {

    private static final long serialVersionUID = 1L;

    private final NodeId mNode;

    public UnknownNodeException(NodeId node) {
        super("Unknown node: " + node);
        mNode = node;
    }

    /**
     * Returns the id which could not be found.
     */
    public NodeId getNode() {
        return mNode;
    }
}
