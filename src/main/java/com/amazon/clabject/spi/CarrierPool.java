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

package com.amazon.clabject.spi;

import java.util.HashMap;
import java.util.Map;

import org.cojen.util.KeyFactory;

import com.amazon.clabject.NodeId;
import com.amazon.clabject.UnknownNodeException;

/**
 * Pool of carrier nodes mapped by owner and potency. Carriers are lazily
 * created in the {@link NodeGraph} upon first request and then reused.
 *
 * <p>CarrierPool is not thread-safe. Callers must serialize access.
 *
 * @author Brian S O'Neill
 */
public class CarrierPool {
    private final NodeGraph mGraph;
    private final Map<Object, NodeId> mCarriers;

    public CarrierPool(NodeGraph graph) {
        if (graph == null) {
            throw new IllegalArgumentException("NodeGraph cannot be null");
        }
        mGraph = graph;
        mCarriers = new HashMap<Object, NodeId>();
    }

    /**
     * Returns the carrier for the given owner and potency, creating it if
     * necessary.
     *
     * @throws IllegalArgumentException if potency is less than two
     * @throws UnknownNodeException if owner is not in the graph
     */
    public NodeId get(NodeId owner, int potency) throws UnknownNodeException {
        Object key = key(owner, potency);
        NodeId carrier = mCarriers.get(key);
        if (carrier == null) {
            carrier = mGraph.createCarrier(owner, potency);
            mCarriers.put(key, carrier);
        }
        return carrier;
    }

    /**
     * Returns the carrier for the given owner and potency, or null if none
     * has been created.
     */
    public NodeId peek(NodeId owner, int potency) {
        if (potency < 2) {
            return null;
        }
        return mCarriers.get(key(owner, potency));
    }

    /**
     * Removes a carrier from the pool and from the graph.
     */
    void remove(NodeId owner, int potency) {
        NodeId carrier = mCarriers.remove(key(owner, potency));
        if (carrier != null) {
            mGraph.discard(carrier);
        }
    }

    public int size() {
        return mCarriers.size();
    }

    private static Object key(NodeId owner, int potency) {
        if (potency < 2) {
            throw new IllegalArgumentException("Only deep declarations have carriers: " + potency);
        }
        return KeyFactory.createKey(new Object[] {owner, potency});
    }
}
