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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import com.amazon.clabject.CycleDetectedException;
import com.amazon.clabject.NodeId;
import com.amazon.clabject.PropagationFailedException;
import com.amazon.clabject.UnknownNodeException;

/**
 * Recomputes the resolved ancestors of every node in the instantiation
 * subtree below a node whose declarations changed. The origin itself is not
 * recomputed.
 *
 * <p>Propagation is all or nothing. New ancestor lists are computed for the
 * whole subtree first, and are committed only if every one succeeded.
 *
 * @author Brian S O'Neill
 */
public class PropagationEngine {
    private final Log mLog = LogFactory.getLog(PropagationEngine.class);

    private final NodeGraph mGraph;
    private final AncestorSynthesizer mSynthesizer;

    public PropagationEngine(NodeGraph graph, AncestorSynthesizer synthesizer) {
        mGraph = graph;
        mSynthesizer = synthesizer;
    }

    /**
     * @return number of descendants updated
     * @throws UnknownNodeException if origin is not in the graph
     * @throws PropagationFailedException if any descendant could not be
     * recomputed, in which case none were updated
     */
    public int propagateFrom(NodeId origin)
        throws UnknownNodeException, PropagationFailedException
    {
        mGraph.get(origin);

        Map<NodeId, List<NodeId>> pending = new LinkedHashMap<NodeId, List<NodeId>>();

        try {
            List<NodeId> stack = new ArrayList<NodeId>();
            stack.addAll(mGraph.getInstances(origin));
            while (!stack.isEmpty()) {
                NodeId id = stack.remove(stack.size() - 1);
                if (pending.containsKey(id)) {
                    throw new CycleDetectedException(id, "Instance index revisits " + id);
                }
                pending.put(id, mSynthesizer.synthesize(id));
                stack.addAll(mGraph.getInstances(id));
            }
        } catch (UnknownNodeException e) {
            throw new PropagationFailedException(origin, e);
        } catch (CycleDetectedException e) {
            throw new PropagationFailedException(origin, e);
        }

        for (Map.Entry<NodeId, List<NodeId>> entry : pending.entrySet()) {
            mGraph.setResolvedAncestors(entry.getKey(), entry.getValue());
        }

        if (mLog.isDebugEnabled()) {
            mLog.debug("Propagated from " + origin + " to " + pending.size() + " descendants");
        }

        return pending.size();
    }
}
