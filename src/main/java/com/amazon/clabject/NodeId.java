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

import java.io.Serializable;

/**
 * Immutable handle to a node in a {@link Model}. A node is simultaneously a
 * type, able to produce further nodes, and an instance of the node which
 * generated it. Carriers are nodes too, and share this identifier space.
 *
 * <p>NodeIds are only meaningful within the model which issued them.
 *
 * @author Brian S O'Neill
 */
public final class NodeId implements Serializable, Comparable<NodeId> {
    private static final long serialVersionUID = 1L;

    private final long mValue;

    public NodeId(long value) {
        mValue = value;
    }

    public long longValue() {
        return mValue;
    }

    public int compareTo(NodeId other) {
        return mValue < other.mValue ? -1 : (mValue > other.mValue ? 1 : 0);
    }

    @Override
    public int hashCode() {
        return (int) (mValue ^ (mValue >>> 32));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof NodeId) {
            return mValue == ((NodeId) obj).mValue;
        }
        return false;
    }

    @Override
    public String toString() {
        return "#" + mValue;
    }
}
