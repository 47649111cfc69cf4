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

import java.util.ArrayList;
import java.util.List;

import com.amazon.clabject.CycleDetectedException;
import com.amazon.clabject.NodeId;
import com.amazon.clabject.UnknownNodeException;

/**
 * Decides which carriers must be spliced into a node's resolved ancestors.
 *
 * <p>A carrier for owner <i>A</i> and potency <i>p</i> is linked into node
 * <i>N</i> exactly when <i>N</i> is <i>p</i> generator links below <i>A</i>.
 * Nodes further down reach the carrier transitively, through the resolved
 * ancestors of the node at exact depth, so they are not matched again.
 *
 * @author Brian S O'Neill
 */
public class PotencyResolver {
    private final NodeGraph mGraph;
    private final CarrierPool mCarriers;

    public PotencyResolver(NodeGraph graph, CarrierPool carriers) {
        mGraph = graph;
        mCarriers = carriers;
    }

    /**
     * Returns the carriers due at the given node, nearest owner first.
     *
     * @throws UnknownNodeException if node or any generator on its chain is
     * not in the graph
     * @throws CycleDetectedException if the generator chain revisits a node
     */
    public List<NodeId> carriersFor(NodeId node)
        throws UnknownNodeException, CycleDetectedException
    {
        List<NodeId> chain = mGraph.getGeneratorChain(node);
        List<NodeId> carriers = new ArrayList<NodeId>();
        // Index zero is one level up, and potency one never has a carrier.
        for (int i=1; i<chain.size(); i++) {
            NodeId carrier = mCarriers.peek(chain.get(i), i + 1);
            if (carrier != null) {
                carriers.add(carrier);
            }
        }
        return carriers;
    }
}
